package com.yhy.cutplan.cut.vo;

public enum PlanStatus {
    COMPLETE,
    PARTIAL
}
