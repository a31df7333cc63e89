package com.sunny.conduit.job.scheduler;

import com.sunny.conduit.job.core.enums.ExecutionStatus;
import com.sunny.conduit.job.core.enums.TriggerStatus;
import com.sunny.conduit.job.core.model.Trigger;
import com.sunny.conduit.job.core.model.TriggerExecution;
import com.sunny.conduit.job.core.spi.ExecutionStore;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 测试用内存存储，语义与数据库实现一致
 */
class InMemoryExecutionStore implements ExecutionStore {

    private final Map<Long, Trigger> triggers = new LinkedHashMap<>();
    private final Map<Long, TriggerExecution> executions = new LinkedHashMap<>();
    private final AtomicLong executionIds = new AtomicLong();
    private int maxRunningObserved;

    synchronized void put(Trigger trigger) {
        triggers.put(trigger.id(), trigger);
    }

    /**
     * 直接写入执行记录，用于构造遗留数据
     */
    synchronized void putExecution(TriggerExecution execution) {
        executions.put(execution.id(), execution);
        executionIds.set(Math.max(executionIds.get(), execution.id()));
    }

    synchronized Trigger trigger(long id) {
        return triggers.get(id);
    }

    synchronized List<TriggerExecution> executions() {
        return new ArrayList<>(executions.values());
    }

    synchronized List<TriggerExecution> executionsOf(long triggerId) {
        return executions.values().stream().filter(e -> e.triggerId() == triggerId).toList();
    }

    synchronized int runningCount() {
        return (int) executions.values().stream().filter(e -> e.status() == ExecutionStatus.RUNNING).count();
    }

    synchronized int maxRunningObserved() {
        return maxRunningObserved;
    }

    @Override
    public synchronized List<Trigger> listDueTriggers(long now, int limit) {
        return triggers.values().stream()
                .filter(t -> t.status() == TriggerStatus.ENABLED && t.nextRunAt() <= now)
                .sorted(Comparator.comparingLong(Trigger::nextRunAt).thenComparingLong(Trigger::id))
                .limit(limit)
                .toList();
    }

    @Override
    public synchronized Optional<Trigger> findTrigger(long triggerId) {
        return Optional.ofNullable(triggers.get(triggerId));
    }

    @Override
    public synchronized Optional<TriggerExecution> getRunningExecution(long triggerId) {
        return executions.values().stream()
                .filter(e -> e.triggerId() == triggerId && e.status() == ExecutionStatus.RUNNING)
                .findFirst();
    }

    @Override
    public synchronized TriggerExecution createExecution(Trigger trigger, int attempt, long startedAt, String eventSample) {
        TriggerExecution execution = new TriggerExecution(executionIds.incrementAndGet(), trigger.id(), trigger.jobId(),
                trigger.tenantId(), ExecutionStatus.RUNNING, attempt, startedAt, null, null, eventSample);
        executions.put(execution.id(), execution);
        maxRunningObserved = Math.max(maxRunningObserved, runningCount());
        return execution;
    }

    @Override
    public synchronized void updateExecution(long executionId, ExecutionStatus status, String error, Long finishedAt) {
        TriggerExecution current = executions.get(executionId);
        executions.put(executionId, current.finish(status, error, finishedAt == null ? 0 : finishedAt));
    }

    @Override
    public synchronized boolean abandonExecution(long executionId, String error, long finishedAt) {
        TriggerExecution current = executions.get(executionId);
        if (current == null || current.status() != ExecutionStatus.RUNNING) {
            return false;
        }
        executions.put(executionId, current.finish(ExecutionStatus.FAILED, error, finishedAt));
        return true;
    }

    @Override
    public synchronized void updateTriggerNextRun(long triggerId, long nextRunAt) {
        triggers.computeIfPresent(triggerId, (id, t) -> t.withNextRunAt(nextRunAt));
    }

    @Override
    public synchronized boolean claimTrigger(long triggerId, long expectedNextRunAt, long nextRunAt) {
        Trigger current = triggers.get(triggerId);
        if (current == null || current.nextRunAt() != expectedNextRunAt) {
            return false;
        }
        triggers.put(triggerId, current.withNextRunAt(nextRunAt));
        return true;
    }

    @Override
    public synchronized void updateTriggerRetryState(long triggerId, int failedAttempts, Long nextRunAt, String lastError) {
        Trigger t = triggers.get(triggerId);
        triggers.put(triggerId, new Trigger(t.id(), t.tenantId(), t.name(), t.kind(), t.status(),
                nextRunAt == null ? t.nextRunAt() : nextRunAt, t.rule(), t.job(), t.maxAttempts(),
                t.backoffBaseMs(), t.timeoutMs(), failedAttempts, lastError, t.watermark()));
    }

    @Override
    public synchronized void recordEvaluationError(long triggerId, long nextRunAt, String lastError) {
        Trigger t = triggers.get(triggerId);
        triggers.put(triggerId, new Trigger(t.id(), t.tenantId(), t.name(), t.kind(), t.status(),
                nextRunAt, t.rule(), t.job(), t.maxAttempts(), t.backoffBaseMs(), t.timeoutMs(),
                t.failedAttempts(), lastError, t.watermark()));
    }

    @Override
    public synchronized void advanceWatermark(long triggerId, long watermark) {
        Trigger t = triggers.get(triggerId);
        if (t == null || t.watermark() >= watermark) {
            return;
        }
        triggers.put(triggerId, new Trigger(t.id(), t.tenantId(), t.name(), t.kind(), t.status(),
                t.nextRunAt(), t.rule(), t.job(), t.maxAttempts(), t.backoffBaseMs(), t.timeoutMs(),
                t.failedAttempts(), t.lastError(), watermark));
    }

    @Override
    public synchronized Optional<TriggerExecution> findExecution(long executionId) {
        return Optional.ofNullable(executions.get(executionId));
    }

    @Override
    public synchronized List<TriggerExecution> listRecentExecutions(long jobId, String tenantId, int limit) {
        return executions.values().stream()
                .filter(e -> e.jobId() == jobId && e.tenantId().equals(tenantId))
                .sorted(Comparator.comparingLong(TriggerExecution::startedAt).reversed())
                .limit(limit)
                .toList();
    }
}
