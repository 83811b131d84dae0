package com.yhy.cutplan.cut.vo;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@AllArgsConstructor
@NoArgsConstructor
@Builder
public class Shortage {
    private int requestIndex;
    private String label;
    private double length;
    private int required;
    private int fulfilled;
    private int missing;
    private ShortageReason reason;
}
