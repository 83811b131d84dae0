package com.yhy.cutplan.cut.vo;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * 模式中的一段：对应需求行的下标、长度和件数
 */
@Value
@Builder
@Jacksonized
public class PatternItem {
    int requestIndex;
    String label;
    double length;
    int quantity;
}
