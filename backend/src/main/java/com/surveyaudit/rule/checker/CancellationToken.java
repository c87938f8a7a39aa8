package com.surveyaudit.rule.checker;

import java.util.concurrent.CancellationException;

/**
 * 运行级取消令牌，传播到所有执行中的检查项
 */
public final class CancellationToken {

    private volatile boolean cancelled;

    public static CancellationToken create() {
        return new CancellationToken();
    }

    public void cancel() {
        cancelled = true;
    }

    public boolean isCancelled() {
        return cancelled;
    }

    /**
     * 已取消或当前线程被中断（超时）时抛出 {@link CancellationException}
     */
    public void throwIfCancelled() {
        if (cancelled) {
            throw new CancellationException("检测运行已取消");
        }
        if (Thread.currentThread().isInterrupted()) {
            throw new CancellationException("检查任务被中断");
        }
    }
}
