package com.yhy.cutplan.cut.vo;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@AllArgsConstructor
@NoArgsConstructor
public class ValidateRequest {

    @NotNull(message = "job不能为空")
    private Job job;

    @NotNull(message = "plan不能为空")
    private CuttingPlan plan;
}
