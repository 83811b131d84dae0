package com.yhy.cutplan.cut.vo;

public enum JobStatus {
    COMPLETE,
    PARTIAL,
    FAILED
}
