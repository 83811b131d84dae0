package com.yhy.cutplan.cut.service;

import com.yhy.cutplan.cut.exception.PlanCancelledException;

import java.time.Duration;

/**
 * 协作式取消标记。子标记在父标记取消或自身到期时同样视为已取消。
 */
public final class CancellationToken {

    private final CancellationToken parent;
    private final long deadlineNanos;
    private final boolean hasDeadline;
    private volatile boolean cancelled;

    private CancellationToken(CancellationToken parent, Duration timeout) {
        this.parent = parent;
        this.hasDeadline = timeout != null;
        this.deadlineNanos = timeout == null ? 0L : System.nanoTime() + timeout.toNanos();
    }

    public static CancellationToken create() {
        return new CancellationToken(null, null);
    }

    /** 从现在起计时，到期自动取消 */
    public CancellationToken withTimeout(Duration timeout) {
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            return new CancellationToken(this, null);
        }
        return new CancellationToken(this, timeout);
    }

    public void cancel() {
        cancelled = true;
    }

    public boolean isCancelled() {
        return cancelled
                || (parent != null && parent.isCancelled())
                || isExpired();
    }

    private boolean isExpired() {
        return hasDeadline && System.nanoTime() - deadlineNanos >= 0;
    }

    /**
     * 已取消、到期或线程被中断时抛出 {@link PlanCancelledException}。
     */
    public void checkpoint() {
        if (Thread.currentThread().isInterrupted()) {
            throw new PlanCancelledException("worker thread interrupted");
        }
        if (isExpired()) {
            throw new PlanCancelledException("job timed out");
        }
        if (isCancelled()) {
            throw new PlanCancelledException("batch cancelled");
        }
    }
}
