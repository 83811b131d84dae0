package com.yhy.cutplan.cut.vo;

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
public class JobError {
    private ErrorKind kind;
    private String message;
    @Builder.Default
    private List<String> violations = new ArrayList<>();
}
