package com.yhy.cutplan.cut.vo;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@AllArgsConstructor
@NoArgsConstructor
@Builder
public class CuttingPlan {
    private String jobId;
    private PlanStatus status;
    @Builder.Default
    private List<StockAssignment> assignments = new ArrayList<>();
    @Builder.Default
    private List<Shortage> shortages = new ArrayList<>();

    @JsonIgnore
    public boolean isComplete() {
        return status == PlanStatus.COMPLETE;
    }
}
