package com.sunny.conduit.job.scheduler;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sunny.conduit.common.constant.ErrorType;
import com.sunny.conduit.common.exception.ConflictException;
import com.sunny.conduit.common.exception.NotFoundException;
import com.sunny.conduit.common.exception.ServiceUnavailableException;
import com.sunny.conduit.common.exception.TooManyRequestsException;
import com.sunny.conduit.job.core.common.Constants;
import com.sunny.conduit.job.core.enums.ExecutionStatus;
import com.sunny.conduit.job.core.model.JobRunResult;
import com.sunny.conduit.job.core.model.Trigger;
import com.sunny.conduit.job.core.model.TriggerExecution;
import com.sunny.conduit.job.core.spi.ConditionStateProvider;
import com.sunny.conduit.job.core.spi.ExecutionListener;
import com.sunny.conduit.job.core.spi.ExecutionStore;
import com.sunny.conduit.job.core.spi.JobCommandGateway;
import com.sunny.conduit.job.core.spi.JobRunner;
import com.sunny.conduit.job.core.strategy.retry.RetryPolicy;
import com.sunny.conduit.job.scheduler.rule.RuleEvaluation;
import com.sunny.conduit.job.scheduler.rule.TriggerRuleEvaluator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 触发器调度器
 * <p>
 * 单线程轮询到期触发器，对每个触发器求值后分发到有界的执行槽位：
 * <ul>
 *     <li>同一触发器同一时刻最多一条 RUNNING 执行，重叠的到期时刻直接跳过</li>
 *     <li>执行槽位耗尽时触发器保持到期，下一轮再分发</li>
 *     <li>nextRunAt 通过比较更新认领，同一到期时刻只会分发一次</li>
 *     <li>失败按重试策略推迟 nextRunAt，重试用尽后回到正常调度</li>
 *     <li>超过超时与停止宽限期仍为 RUNNING 且不在本实例运行的执行视为遗弃，置为 FAILED</li>
 * </ul>
 * 调度分发与手动执行共用一把分发锁，停止后不会再产生新的执行
 *
 * @author SunnyX6
 * @date 2026-03-05
 */
public class TriggerScheduler implements JobCommandGateway {

    private static final Logger log = LoggerFactory.getLogger(TriggerScheduler.class);

    private static final String ABANDONED_ERROR = "执行已被遗弃: 超过超时与停止宽限期仍未写回结果";

    private final ExecutionStore executionStore;
    private final JobRunner jobRunner;
    private final TriggerRuleEvaluator ruleEvaluator;
    private final ExecutionListener executionListener;
    private final SchedulerProperties properties;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    private final Semaphore workerSlots;
    private final ScheduledExecutorService pollExecutor;
    private final ExecutorService workerExecutor;
    private final ExecutorService jobExecutor;

    /**
     * 本实例内运行中的执行，key 为 executionId
     */
    private final Map<Long, RunningExecution> runningExecutions = new ConcurrentHashMap<>();

    private final Object dispatchLock = new Object();
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean polling = new AtomicBoolean(false);
    private volatile boolean stopped = false;

    public TriggerScheduler(ExecutionStore executionStore,
                            JobRunner jobRunner,
                            SchedulerProperties properties,
                            ConditionStateProvider stateProvider,
                            ExecutionListener executionListener,
                            ObjectMapper objectMapper,
                            Clock clock) {
        this.executionStore = Objects.requireNonNull(executionStore, "executionStore");
        this.jobRunner = Objects.requireNonNull(jobRunner, "jobRunner");
        this.properties = properties == null ? SchedulerProperties.defaults() : properties;
        this.ruleEvaluator = new TriggerRuleEvaluator(stateProvider, this.properties.zone(), this.properties.errorRecheckMs());
        this.executionListener = executionListener == null ? ExecutionListener.NOOP : executionListener;
        this.objectMapper = objectMapper == null ? new ObjectMapper() : objectMapper;
        this.clock = clock == null ? Clock.systemUTC() : clock;

        this.workerSlots = new Semaphore(this.properties.maxWorkers());
        this.pollExecutor = Executors.newSingleThreadScheduledExecutor(namedFactory("conduit-trigger-poller"));
        this.workerExecutor = Executors.newFixedThreadPool(this.properties.maxWorkers(), namedFactory("conduit-trigger-worker"));
        this.jobExecutor = Executors.newCachedThreadPool(namedFactory("conduit-job-call"));
    }

    /**
     * 启动轮询，立即执行第一轮
     */
    public void start() {
        if (stopped) {
            throw new IllegalStateException("调度器已停止，不能再次启动");
        }
        if (!started.compareAndSet(false, true)) {
            log.warn("调度器已启动，忽略重复启动");
            return;
        }
        pollExecutor.scheduleWithFixedDelay(this::pollOnce, 0, properties.pollIntervalMs(), TimeUnit.MILLISECONDS);
        log.info("触发器调度器已启动: pollIntervalMs={}, maxWorkers={}, batchSize={}",
                properties.pollIntervalMs(), properties.maxWorkers(), properties.batchSize());
    }

    /**
     * 停止调度
     * <p>
     * 立即停止轮询与新的分发，在宽限期内等待在途执行结束；
     * 超过宽限期的执行不再等待，结束时仍会尽力写回终态
     */
    public void stop() {
        synchronized (dispatchLock) {
            if (stopped) {
                return;
            }
            stopped = true;
        }
        log.info("停止触发器调度器，在途执行数: {}", runningExecutions.size());

        pollExecutor.shutdown();
        workerExecutor.shutdown();
        jobExecutor.shutdown();
        try {
            pollExecutor.awaitTermination(properties.shutdownGraceMs(), TimeUnit.MILLISECONDS);
            if (!workerExecutor.awaitTermination(properties.shutdownGraceMs(), TimeUnit.MILLISECONDS)) {
                log.warn("宽限期内仍有 {} 个执行未结束，放弃等待: {}",
                        runningExecutions.size(), runningExecutions.keySet());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("等待在途执行结束时被中断");
        }
        log.info("触发器调度器已停止");
    }

    public boolean isRunning() {
        return started.get() && !stopped;
    }

    /**
     * 当前运行中的执行数
     */
    public int runningCount() {
        return properties.maxWorkers() - workerSlots.availablePermits();
    }

    /**
     * 剩余执行槽位
     */
    public int availableSlots() {
        return workerSlots.availablePermits();
    }

    /**
     * 执行一轮轮询
     * <p>
     * 上一轮未结束时直接跳过，单个触发器处理失败不影响同批其他触发器
     */
    public void pollOnce() {
        if (stopped) {
            return;
        }
        if (!polling.compareAndSet(false, true)) {
            log.debug("上一轮轮询尚未结束，跳过本轮");
            return;
        }
        try {
            long now = clock.millis();
            List<Trigger> dueTriggers = executionStore.listDueTriggers(now, properties.batchSize());
            if (!dueTriggers.isEmpty()) {
                log.debug("本轮到期触发器: {}", dueTriggers.size());
            }
            for (Trigger trigger : dueTriggers) {
                if (stopped) {
                    break;
                }
                try {
                    handleDueTrigger(trigger, now);
                } catch (Exception e) {
                    log.error("处理到期触发器失败: triggerId={}", trigger.id(), e);
                }
            }
        } catch (Exception e) {
            log.error("轮询到期触发器失败", e);
        } finally {
            polling.set(false);
        }
    }

    @Override
    public TriggerExecution fireNow(long triggerId, String tenantId) {
        synchronized (dispatchLock) {
            if (stopped) {
                throw new ServiceUnavailableException(ErrorType.SCHEDULER_STOPPED, null, "调度器已停止");
            }
            Trigger trigger = executionStore.findTrigger(triggerId)
                    .filter(t -> Objects.equals(t.tenantId(), tenantId))
                    .orElseThrow(() -> new NotFoundException("触发器不存在: %s", triggerId));

            Optional<TriggerExecution> running = activeExecution(trigger, clock.millis());
            if (running.isPresent()) {
                throw new ConflictException(ErrorType.EXECUTION_RUNNING,
                        Map.of("executionId", String.valueOf(running.get().id())),
                        "触发器已有运行中的执行: %s", running.get().id());
            }
            if (!workerSlots.tryAcquire()) {
                throw new TooManyRequestsException(ErrorType.WORKER_BUSY, null, "没有空闲的执行槽位");
            }

            boolean submitted = false;
            try {
                TriggerExecution execution = executionStore.createExecution(trigger, 1, clock.millis(), null);
                log.info("手动执行触发器: triggerId={}, jobId={}, executionId={}",
                        triggerId, trigger.jobId(), execution.id());
                submit(trigger, execution, trigger.job().params(), false, null);
                submitted = true;
                return execution;
            } finally {
                if (!submitted) {
                    workerSlots.release();
                }
            }
        }
    }

    @Override
    public void cancel(long executionId, String tenantId) {
        RunningExecution handle = runningExecutions.get(executionId);
        if (handle == null || !Objects.equals(handle.execution.tenantId(), tenantId)) {
            Optional<TriggerExecution> stored = executionStore.findExecution(executionId)
                    .filter(e -> Objects.equals(e.tenantId(), tenantId));
            if (stored.isPresent() && stored.get().status().isTerminal()) {
                throw new ConflictException("执行已结束: %s", executionId);
            }
            throw new NotFoundException("运行中的执行不存在: %s", executionId);
        }
        log.info("取消执行: executionId={}, triggerId={}", executionId, handle.execution.triggerId());
        handle.cancel();
    }

    private void handleDueTrigger(Trigger trigger, long now) {
        RuleEvaluation evaluation = ruleEvaluator.evaluate(trigger, now);
        switch (evaluation.outcome()) {
            case FIRE -> dispatchScheduled(trigger, evaluation);
            case WAIT -> {
                boolean claimed = executionStore.claimTrigger(trigger.id(), trigger.nextRunAt(), evaluation.nextRunAt());
                log.debug("条件未满足，下次复查: triggerId={}, nextRunAt={}", trigger.id(), evaluation.nextRunAt());
                if (claimed && trigger.failedAttempts() > 0) {
                    log.info("重试时刻条件不再满足，结束本轮重试: triggerId={}, failedAttempts={}",
                            trigger.id(), trigger.failedAttempts());
                    executionStore.updateTriggerRetryState(trigger.id(), 0, null, null);
                }
            }
            case INVALID -> {
                log.warn("触发规则求值失败: triggerId={}, reason={}", trigger.id(), evaluation.reason());
                String reason = truncate(evaluation.reason());
                executionStore.recordEvaluationError(trigger.id(), evaluation.nextRunAt(), reason);
                if (trigger.failedAttempts() > 0) {
                    executionStore.updateTriggerRetryState(trigger.id(), 0, null, reason);
                }
            }
        }
    }

    private void dispatchScheduled(Trigger trigger, RuleEvaluation evaluation) {
        synchronized (dispatchLock) {
            if (stopped) {
                return;
            }
            Optional<TriggerExecution> running = activeExecution(trigger, clock.millis());
            if (running.isPresent()) {
                log.info("触发器已有运行中的执行，跳过本次到期: triggerId={}, executionId={}",
                        trigger.id(), running.get().id());
                executionStore.updateTriggerNextRun(trigger.id(), evaluation.nextRunAt());
                return;
            }
            if (!workerSlots.tryAcquire()) {
                log.debug("没有空闲的执行槽位，下一轮再分发: triggerId={}", trigger.id());
                return;
            }

            boolean submitted = false;
            try {
                if (!executionStore.claimTrigger(trigger.id(), trigger.nextRunAt(), evaluation.nextRunAt())) {
                    log.info("触发器已被认领，跳过: triggerId={}", trigger.id());
                    return;
                }
                Map<String, Object> params = trigger.job().params();
                String eventSample = null;
                if (evaluation.eventData() != null) {
                    eventSample = toSample(evaluation.eventData());
                    if (trigger.job().passEventData()) {
                        params = new HashMap<>(params);
                        params.put("event", evaluation.eventData());
                    }
                }
                TriggerExecution execution = executionStore.createExecution(
                        trigger, trigger.nextAttempt(), clock.millis(), eventSample);
                log.info("分发触发器: triggerId={}, jobId={}, executionId={}, attempt={}, nextRunAt={}",
                        trigger.id(), trigger.jobId(), execution.id(), execution.attempt(), evaluation.nextRunAt());
                submit(trigger.withNextRunAt(evaluation.nextRunAt()), execution, params, true, evaluation.watermark());
                submitted = true;
            } finally {
                if (!submitted) {
                    workerSlots.release();
                }
            }
        }
    }

    /**
     * 查询触发器运行中的执行
     * <p>
     * 不在本实例运行、且开始时间早于 超时 + 停止宽限期 的记录是进程退出或崩溃后的遗留，
     * 置为 FAILED 后不再阻塞触发器
     */
    private Optional<TriggerExecution> activeExecution(Trigger trigger, long now) {
        Optional<TriggerExecution> running = executionStore.getRunningExecution(trigger.id());
        if (running.isEmpty() || runningExecutions.containsKey(running.get().id())) {
            return running;
        }
        TriggerExecution stale = running.get();
        if (now < stale.startedAt() + timeoutOf(trigger) + properties.shutdownGraceMs()) {
            return running;
        }
        if (executionStore.abandonExecution(stale.id(), ABANDONED_ERROR, now)) {
            log.warn("回收遗弃的执行: triggerId={}, executionId={}, startedAt={}",
                    trigger.id(), stale.id(), stale.startedAt());
            notifyListener(stale.finish(ExecutionStatus.FAILED, ABANDONED_ERROR, now));
        }
        return executionStore.getRunningExecution(trigger.id());
    }

    /**
     * 提交执行，调用方已持有槽位
     *
     * @param watermark 条件观测水位，执行结束且没有待重试时推进，非条件触发为 null
     */
    private void submit(Trigger trigger, TriggerExecution execution, Map<String, Object> params, boolean scheduled,
                        Long watermark) {
        RunningExecution handle = new RunningExecution(execution, scheduled, watermark);
        runningExecutions.put(execution.id(), handle);
        notifyListener(execution);
        try {
            workerExecutor.execute(() -> runExecution(trigger, handle, params));
        } catch (RejectedExecutionException e) {
            log.error("执行提交被拒绝: executionId={}", execution.id(), e);
            complete(trigger, handle, ExecutionStatus.FAILED, "执行提交被拒绝");
        }
    }

    private void runExecution(Trigger trigger, RunningExecution handle, Map<String, Object> params) {
        long timeoutMs = timeoutOf(trigger);
        ExecutionStatus status;
        String error = null;
        Future<JobRunResult> future = null;
        try {
            future = jobExecutor.submit(() -> jobRunner.runJob(trigger.jobId(), params, Duration.ofMillis(timeoutMs)));
            handle.attach(future);
            JobRunResult result = future.get(timeoutMs, TimeUnit.MILLISECONDS);
            if (result != null && result.succeeded()) {
                status = ExecutionStatus.SUCCEEDED;
            } else {
                status = ExecutionStatus.FAILED;
                error = result == null ? "任务执行器返回空结果" : result.error();
            }
        } catch (TimeoutException e) {
            future.cancel(true);
            status = ExecutionStatus.FAILED;
            error = "执行超时: " + timeoutMs + "ms";
        } catch (CancellationException e) {
            status = ExecutionStatus.CANCELLED;
            error = "执行已取消";
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            status = ExecutionStatus.FAILED;
            error = cause.getMessage() == null ? cause.getClass().getSimpleName() : cause.getMessage();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            if (future != null) {
                future.cancel(true);
            }
            status = ExecutionStatus.FAILED;
            error = "执行被中断";
        } catch (RejectedExecutionException e) {
            status = ExecutionStatus.FAILED;
            error = "调度器已停止";
        }
        if (handle.cancelRequested && status != ExecutionStatus.SUCCEEDED) {
            status = ExecutionStatus.CANCELLED;
        }
        complete(trigger, handle, status, error);
    }

    /**
     * 写回执行结果，先更新触发器的重试状态，再把执行置为终态，最后释放槽位
     */
    private void complete(Trigger trigger, RunningExecution handle, ExecutionStatus status, String error) {
        TriggerExecution execution = handle.execution;
        long finishedAt = clock.millis();
        String detail = truncate(error);
        try {
            boolean retryPending = handle.scheduled && applyRetryPolicy(trigger, execution, status, detail, finishedAt);
            if (handle.watermark != null && !retryPending) {
                executionStore.advanceWatermark(trigger.id(), handle.watermark);
            }
            executionStore.updateExecution(execution.id(), status, detail, finishedAt);
            if (status == ExecutionStatus.SUCCEEDED) {
                log.info("执行成功: triggerId={}, executionId={}, attempt={}",
                        execution.triggerId(), execution.id(), execution.attempt());
            } else {
                log.warn("执行结束: triggerId={}, executionId={}, status={}, error={}",
                        execution.triggerId(), execution.id(), status.getCode(), detail);
            }
        } catch (Exception e) {
            log.error("写回执行结果失败: executionId={}, status={}", execution.id(), status.getCode(), e);
        } finally {
            runningExecutions.remove(execution.id());
            workerSlots.release();
        }
        notifyListener(execution.finish(status, detail, finishedAt));
    }

    /**
     * 按执行结果更新触发器的重试状态
     *
     * @return 已安排重试时返回 true
     */
    private boolean applyRetryPolicy(Trigger trigger, TriggerExecution execution, ExecutionStatus status,
                                     String detail, long finishedAt) {
        switch (status) {
            case SUCCEEDED -> {
                if (trigger.failedAttempts() > 0 || trigger.lastError() != null) {
                    executionStore.updateTriggerRetryState(trigger.id(), 0, null, null);
                }
            }
            case CANCELLED -> executionStore.updateTriggerRetryState(trigger.id(), 0, null, detail);
            case FAILED -> {
                RetryPolicy policy = retryPolicyOf(trigger);
                int attempt = execution.attempt();
                if (policy.canRetry(attempt)) {
                    long retryAt = finishedAt + policy.nextDelay(attempt);
                    executionStore.updateTriggerRetryState(trigger.id(), attempt, retryAt, detail);
                    log.warn("执行失败，等待重试: triggerId={}, attempt={}/{}, retryAt={}",
                            trigger.id(), attempt, policy.maxAttempts(), retryAt);
                    return true;
                } else {
                    executionStore.updateTriggerRetryState(trigger.id(), 0, null, detail);
                    log.error("执行失败且重试次数已用尽，回到正常调度: triggerId={}, attempts={}",
                            trigger.id(), attempt);
                }
            }
            default -> {
            }
        }
        return false;
    }

    private long timeoutOf(Trigger trigger) {
        return trigger.timeoutMs() > 0 ? trigger.timeoutMs() : properties.jobTimeoutMs();
    }

    private RetryPolicy retryPolicyOf(Trigger trigger) {
        RetryPolicy defaults = properties.retryPolicy();
        int attempts = trigger.maxAttempts() > 0 ? trigger.maxAttempts() : defaults.maxAttempts();
        long baseMs = trigger.backoffBaseMs() > 0 ? trigger.backoffBaseMs() : defaults.backoffBaseMs();
        return defaults.withAttempts(attempts, baseMs);
    }

    private void notifyListener(TriggerExecution execution) {
        try {
            executionListener.onExecutionChanged(execution);
        } catch (Exception e) {
            log.warn("执行状态监听回调失败: executionId={}", execution.id(), e);
        }
    }

    private String toSample(Map<String, Object> eventData) {
        try {
            String json = objectMapper.writeValueAsString(eventData);
            return json.length() > Constants.MAX_EVENT_SAMPLE_LENGTH
                    ? json.substring(0, Constants.MAX_EVENT_SAMPLE_LENGTH)
                    : json;
        } catch (JsonProcessingException e) {
            log.warn("观测数据序列化失败", e);
            return null;
        }
    }

    private static String truncate(String text) {
        if (text == null || text.length() <= Constants.MAX_ERROR_LENGTH) {
            return text;
        }
        return text.substring(0, Constants.MAX_ERROR_LENGTH);
    }

    private static ThreadFactory namedFactory(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread thread = new Thread(r, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    /**
     * 运行中执行的句柄，取消可能早于任务调用提交
     */
    private static final class RunningExecution {

        private final TriggerExecution execution;
        private final boolean scheduled;
        private final Long watermark;
        private volatile Future<?> future;
        private volatile boolean cancelRequested;

        private RunningExecution(TriggerExecution execution, boolean scheduled, Long watermark) {
            this.execution = execution;
            this.scheduled = scheduled;
            this.watermark = watermark;
        }

        private void attach(Future<?> future) {
            this.future = future;
            if (cancelRequested) {
                future.cancel(true);
            }
        }

        private void cancel() {
            cancelRequested = true;
            Future<?> current = future;
            if (current != null) {
                current.cancel(true);
            }
        }
    }
}
