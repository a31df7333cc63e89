package com.sunny.conduit.job.core.model;

/**
 * 任务执行结果
 *
 * @param succeeded 是否成功
 * @param error     失败原因
 * @author SunnyX6
 * @date 2026-03-03
 */
public record JobRunResult(boolean succeeded, String error) {

    public static JobRunResult ok() {
        return new JobRunResult(true, null);
    }

    public static JobRunResult failed(String error) {
        return new JobRunResult(false, error);
    }
}
