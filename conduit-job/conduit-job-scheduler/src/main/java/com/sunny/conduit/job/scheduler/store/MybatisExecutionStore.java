package com.sunny.conduit.job.scheduler.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sunny.conduit.common.exception.InternalException;
import com.sunny.conduit.job.core.enums.ExecutionStatus;
import com.sunny.conduit.job.core.enums.MatchMode;
import com.sunny.conduit.job.core.enums.TriggerKind;
import com.sunny.conduit.job.core.enums.TriggerStatus;
import com.sunny.conduit.job.core.model.Condition;
import com.sunny.conduit.job.core.model.Trigger;
import com.sunny.conduit.job.core.model.TriggerExecution;
import com.sunny.conduit.job.core.model.TriggerJob;
import com.sunny.conduit.job.core.model.TriggerRule;
import com.sunny.conduit.job.core.spi.ExecutionStore;
import com.sunny.conduit.job.scheduler.store.entity.TriggerEntity;
import com.sunny.conduit.job.scheduler.store.entity.TriggerExecutionEntity;
import com.sunny.conduit.job.scheduler.store.mapper.TriggerExecutionMapper;
import com.sunny.conduit.job.scheduler.store.mapper.TriggerMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * 基于 MyBatis-Plus 的执行存储
 * <p>
 * 认领依赖单条 UPDATE 的 next_run_at 比较，多个调度实例共享同一张表时也只有一个能认领成功
 *
 * @author SunnyX6
 * @date 2026-03-05
 */
public class MybatisExecutionStore implements ExecutionStore {

    private static final Logger log = LoggerFactory.getLogger(MybatisExecutionStore.class);

    private static final TypeReference<Map<String, Object>> PARAMS_TYPE = new TypeReference<>() {
    };
    private static final TypeReference<List<Condition>> CONDITIONS_TYPE = new TypeReference<>() {
    };

    private final TriggerMapper triggerMapper;
    private final TriggerExecutionMapper executionMapper;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public MybatisExecutionStore(TriggerMapper triggerMapper,
                                 TriggerExecutionMapper executionMapper,
                                 ObjectMapper objectMapper,
                                 Clock clock) {
        this.triggerMapper = triggerMapper;
        this.executionMapper = executionMapper;
        this.objectMapper = objectMapper;
        this.clock = clock == null ? Clock.systemUTC() : clock;
    }

    @Override
    public List<Trigger> listDueTriggers(long now, int limit) {
        List<TriggerEntity> entities = triggerMapper.selectDue(now, limit);
        List<Trigger> triggers = new ArrayList<>(entities.size());
        for (TriggerEntity entity : entities) {
            try {
                triggers.add(toTrigger(entity));
            } catch (RuntimeException e) {
                log.error("触发器数据无法解析，跳过: triggerId={}", entity.getId(), e);
            }
        }
        return triggers;
    }

    @Override
    public Optional<Trigger> findTrigger(long triggerId) {
        return Optional.ofNullable(triggerMapper.selectById(triggerId)).map(this::toTrigger);
    }

    @Override
    public Optional<TriggerExecution> getRunningExecution(long triggerId) {
        return Optional.ofNullable(executionMapper.selectRunning(triggerId)).map(this::toExecution);
    }

    @Override
    public TriggerExecution createExecution(Trigger trigger, int attempt, long startedAt, String eventSample) {
        TriggerExecutionEntity entity = new TriggerExecutionEntity();
        entity.setTriggerId(trigger.id());
        entity.setJobId(trigger.jobId());
        entity.setTenantId(trigger.tenantId());
        entity.setStatus(ExecutionStatus.RUNNING.getCode());
        entity.setAttempt(attempt);
        entity.setStartedAt(startedAt);
        entity.setEventSample(eventSample);
        executionMapper.insert(entity);
        return toExecution(entity);
    }

    @Override
    public void updateExecution(long executionId, ExecutionStatus status, String error, Long finishedAt) {
        executionMapper.updateResult(executionId, status.getCode(), error, finishedAt);
    }

    @Override
    public boolean abandonExecution(long executionId, String error, long finishedAt) {
        return executionMapper.abandon(executionId, error, finishedAt) == 1;
    }

    @Override
    public void updateTriggerNextRun(long triggerId, long nextRunAt) {
        triggerMapper.updateNextRun(triggerId, nextRunAt, clock.millis());
    }

    @Override
    public boolean claimTrigger(long triggerId, long expectedNextRunAt, long nextRunAt) {
        return triggerMapper.claim(triggerId, expectedNextRunAt, nextRunAt, clock.millis()) == 1;
    }

    @Override
    public void updateTriggerRetryState(long triggerId, int failedAttempts, Long nextRunAt, String lastError) {
        triggerMapper.updateRetryState(triggerId, failedAttempts, nextRunAt, lastError, clock.millis());
    }

    @Override
    public void advanceWatermark(long triggerId, long watermark) {
        triggerMapper.advanceWatermark(triggerId, watermark, clock.millis());
    }

    @Override
    public void recordEvaluationError(long triggerId, long nextRunAt, String lastError) {
        triggerMapper.updateEvaluationError(triggerId, nextRunAt, lastError, clock.millis());
    }

    @Override
    public Optional<TriggerExecution> findExecution(long executionId) {
        return Optional.ofNullable(executionMapper.selectById(executionId)).map(this::toExecution);
    }

    @Override
    public List<TriggerExecution> listRecentExecutions(long jobId, String tenantId, int limit) {
        return executionMapper.selectRecentByJob(jobId, tenantId, limit).stream()
                .map(this::toExecution)
                .toList();
    }

    /**
     * 保存触发器，用于初始化数据与测试
     *
     * @return 带自增 ID 的触发器
     */
    public Trigger insertTrigger(Trigger trigger) {
        long now = clock.millis();
        TriggerEntity entity = new TriggerEntity();
        entity.setTenantId(trigger.tenantId());
        entity.setName(trigger.name());
        entity.setKind(trigger.kind().getCode());
        entity.setStatus(trigger.status().getCode());
        entity.setNextRunAt(trigger.nextRunAt());
        TriggerRule rule = trigger.rule();
        entity.setRuleExpression(rule.expression());
        entity.setConditionSource(rule.source());
        entity.setMatchMode(rule.matchMode().name().toLowerCase(Locale.ROOT));
        entity.setConditionJson(writeJson(rule.conditions()));
        entity.setCheckIntervalMs(rule.checkIntervalMs());
        entity.setJobId(trigger.jobId());
        entity.setJobParams(writeJson(trigger.job().params()));
        entity.setPassEventData(trigger.job().passEventData());
        entity.setMaxAttempts(trigger.maxAttempts());
        entity.setBackoffBaseMs(trigger.backoffBaseMs());
        entity.setTimeoutMs(trigger.timeoutMs());
        entity.setFailedAttempts(trigger.failedAttempts());
        entity.setLastError(trigger.lastError());
        entity.setConditionWatermark(trigger.watermark());
        entity.setCreatedAt(now);
        entity.setUpdatedAt(now);
        triggerMapper.insert(entity);
        return toTrigger(entity);
    }

    private Trigger toTrigger(TriggerEntity entity) {
        TriggerKind kind = TriggerKind.of(entity.getKind());
        MatchMode matchMode = entity.getMatchMode() == null
                ? MatchMode.ALL
                : MatchMode.valueOf(entity.getMatchMode().toUpperCase(Locale.ROOT));
        TriggerRule rule = new TriggerRule(
                entity.getRuleExpression(),
                entity.getConditionSource(),
                matchMode,
                readJson(entity.getConditionJson(), CONDITIONS_TYPE),
                nullToZero(entity.getCheckIntervalMs()));
        TriggerJob job = new TriggerJob(
                entity.getJobId(),
                readJson(entity.getJobParams(), PARAMS_TYPE),
                Boolean.TRUE.equals(entity.getPassEventData()));
        return new Trigger(
                entity.getId(),
                entity.getTenantId(),
                entity.getName(),
                kind,
                TriggerStatus.of(entity.getStatus()),
                nullToZero(entity.getNextRunAt()),
                rule,
                job,
                entity.getMaxAttempts() == null ? 0 : entity.getMaxAttempts(),
                nullToZero(entity.getBackoffBaseMs()),
                nullToZero(entity.getTimeoutMs()),
                entity.getFailedAttempts() == null ? 0 : entity.getFailedAttempts(),
                entity.getLastError(),
                nullToZero(entity.getConditionWatermark()));
    }

    private TriggerExecution toExecution(TriggerExecutionEntity entity) {
        return new TriggerExecution(
                entity.getId(),
                entity.getTriggerId(),
                entity.getJobId(),
                entity.getTenantId(),
                ExecutionStatus.of(entity.getStatus()),
                entity.getAttempt() == null ? 1 : entity.getAttempt(),
                nullToZero(entity.getStartedAt()),
                entity.getFinishedAt(),
                entity.getError(),
                entity.getEventSample());
    }

    private <T> T readJson(String json, TypeReference<T> type) {
        if (json == null || json.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new InternalException(e, "JSON 解析失败: %s", e.getOriginalMessage());
        }
    }

    private String writeJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new InternalException(e, "JSON 序列化失败: %s", e.getOriginalMessage());
        }
    }

    private static long nullToZero(Long value) {
        return value == null ? 0L : value;
    }
}
