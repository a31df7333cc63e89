package com.sunny.conduit.job.scheduler.store.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableField;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;

/**
 * 触发器实体
 * <p>
 * 对应 conduit_trigger 表，kind、status 存小写编码，条件与参数存 JSON
 *
 * @author SunnyX6
 * @date 2026-03-05
 */
@TableName("conduit_trigger")
public class TriggerEntity {

    @TableId(type = IdType.AUTO)
    private Long id;
    private String tenantId;
    private String name;

    /**
     * interval / cron / condition
     */
    private String kind;

    /**
     * enabled / paused / disabled / error
     */
    private String status;

    /**
     * 下次可运行时间（毫秒）
     */
    private Long nextRunAt;

    /**
     * 间隔或 Cron 表达式
     */
    private String ruleExpression;
    private String conditionSource;
    private String matchMode;

    /**
     * 条件列表（JSON）
     */
    @TableField("condition_json")
    private String conditionJson;
    private Long checkIntervalMs;
    private Long jobId;

    /**
     * 任务参数（JSON）
     */
    private String jobParams;
    private Boolean passEventData;
    private Integer maxAttempts;
    private Long backoffBaseMs;
    private Long timeoutMs;
    private Integer failedAttempts;
    private String lastError;

    /**
     * 条件观测水位
     */
    private Long conditionWatermark;
    private Long createdAt;
    private Long updatedAt;

    public Long getId() {
        return id;
    }

    public void setId(Long id) {
        this.id = id;
    }

    public String getTenantId() {
        return tenantId;
    }

    public void setTenantId(String tenantId) {
        this.tenantId = tenantId;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getKind() {
        return kind;
    }

    public void setKind(String kind) {
        this.kind = kind;
    }

    public String getStatus() {
        return status;
    }

    public void setStatus(String status) {
        this.status = status;
    }

    public Long getNextRunAt() {
        return nextRunAt;
    }

    public void setNextRunAt(Long nextRunAt) {
        this.nextRunAt = nextRunAt;
    }

    public String getRuleExpression() {
        return ruleExpression;
    }

    public void setRuleExpression(String ruleExpression) {
        this.ruleExpression = ruleExpression;
    }

    public String getConditionSource() {
        return conditionSource;
    }

    public void setConditionSource(String conditionSource) {
        this.conditionSource = conditionSource;
    }

    public String getMatchMode() {
        return matchMode;
    }

    public void setMatchMode(String matchMode) {
        this.matchMode = matchMode;
    }

    public String getConditionJson() {
        return conditionJson;
    }

    public void setConditionJson(String conditionJson) {
        this.conditionJson = conditionJson;
    }

    public Long getCheckIntervalMs() {
        return checkIntervalMs;
    }

    public void setCheckIntervalMs(Long checkIntervalMs) {
        this.checkIntervalMs = checkIntervalMs;
    }

    public Long getJobId() {
        return jobId;
    }

    public void setJobId(Long jobId) {
        this.jobId = jobId;
    }

    public String getJobParams() {
        return jobParams;
    }

    public void setJobParams(String jobParams) {
        this.jobParams = jobParams;
    }

    public Boolean getPassEventData() {
        return passEventData;
    }

    public void setPassEventData(Boolean passEventData) {
        this.passEventData = passEventData;
    }

    public Integer getMaxAttempts() {
        return maxAttempts;
    }

    public void setMaxAttempts(Integer maxAttempts) {
        this.maxAttempts = maxAttempts;
    }

    public Long getBackoffBaseMs() {
        return backoffBaseMs;
    }

    public void setBackoffBaseMs(Long backoffBaseMs) {
        this.backoffBaseMs = backoffBaseMs;
    }

    public Long getTimeoutMs() {
        return timeoutMs;
    }

    public void setTimeoutMs(Long timeoutMs) {
        this.timeoutMs = timeoutMs;
    }

    public Integer getFailedAttempts() {
        return failedAttempts;
    }

    public void setFailedAttempts(Integer failedAttempts) {
        this.failedAttempts = failedAttempts;
    }

    public String getLastError() {
        return lastError;
    }

    public void setLastError(String lastError) {
        this.lastError = lastError;
    }

    public Long getConditionWatermark() {
        return conditionWatermark;
    }

    public void setConditionWatermark(Long conditionWatermark) {
        this.conditionWatermark = conditionWatermark;
    }

    public Long getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Long createdAt) {
        this.createdAt = createdAt;
    }

    public Long getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(Long updatedAt) {
        this.updatedAt = updatedAt;
    }
}
