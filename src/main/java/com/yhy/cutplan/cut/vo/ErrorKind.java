package com.yhy.cutplan.cut.vo;

public enum ErrorKind {
    /** 输入数据不合法，优化未开始 */
    INVALID_INPUT,
    /** 校验器与排料结果不一致，属于程序缺陷 */
    INTERNAL_INCONSISTENCY,
    /** 批次取消或任务超时 */
    CANCELLED
}
