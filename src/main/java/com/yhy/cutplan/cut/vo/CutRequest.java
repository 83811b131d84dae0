package com.yhy.cutplan.cut.vo;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class CutRequest {
    double length;
    int quantity;
    String label;
}
