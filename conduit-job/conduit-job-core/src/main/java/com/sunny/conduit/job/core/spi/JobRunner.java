package com.sunny.conduit.job.core.spi;

import com.sunny.conduit.job.core.model.JobRunResult;

import java.time.Duration;
import java.util.Map;

/**
 * 任务执行器
 * <p>
 * 调度器把它当作可能很慢、可能失败的黑盒调用；抛出的异常等同于失败。
 * 超时由调度器强制执行，实现方应响应线程中断
 *
 * @author SunnyX6
 * @date 2026-03-03
 */
@FunctionalInterface
public interface JobRunner {

    JobRunResult runJob(long jobId, Map<String, Object> params, Duration timeout);
}
