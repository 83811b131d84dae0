package com.yhy.cutplan.cut.vo;

public enum ShortageReason {
    /** 件长超过所有原料规格 */
    INFEASIBLE,
    /** 原料库存用尽 */
    STOCK_EXHAUSTED
}
