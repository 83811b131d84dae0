package com.yhy.cutplan.cut.vo;

import jakarta.validation.constraints.NotEmpty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@AllArgsConstructor
@NoArgsConstructor
public class BatchRequest {

    @NotEmpty(message = "jobs不能为空")
    private List<Job> jobs;
}
