package com.surveyaudit.exception;

/**
 * 调度器自身故障（如无法分配工作线程），整个运行中止
 */
public class SchedulerException extends RuntimeException {

    public SchedulerException(String message, Throwable cause) {
        super(message, cause);
    }
}
