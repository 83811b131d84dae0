package com.yhy.cutplan.cut.vo;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * 可用原料规格：长度、库存数量、成本权重
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class StockOption {

    /** 库存不限量 */
    public static final int UNLIMITED = -1;

    String id;
    double length;
    @Builder.Default
    int available = UNLIMITED;
    /** 为空时按长度计 */
    Double costWeight;

    public boolean isUnlimited() {
        return available == UNLIMITED;
    }

    public double effectiveCostWeight() {
        return costWeight == null ? length : costWeight;
    }
}
