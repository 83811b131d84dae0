package com.yhy.cutplan.cut.exception;

/**
 * 排料过程被协作式取消（批次取消或任务超时）
 */
public class PlanCancelledException extends RuntimeException {

    public PlanCancelledException(String message) {
        super(message);
    }
}
