package com.yhy.cutplan.cut.vo;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * 批次汇总：结果与输入任务顺序一致
 */
@Data
@AllArgsConstructor
@NoArgsConstructor
@Builder
public class BatchReport {
    private String batchId;
    @Builder.Default
    private List<JobResult> results = new ArrayList<>();
    @Builder.Default
    private List<MaterialSummary> materials = new ArrayList<>();
    private int totalStockUnits;
    private double totalWaste;
    private int failedJobs;
    private boolean cancelled;
}
