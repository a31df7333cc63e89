package com.sunny.conduit.job.scheduler.store.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableField;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;

/**
 * 触发执行记录实体
 *
 * @author SunnyX6
 * @date 2026-03-05
 */
@TableName("conduit_trigger_execution")
public class TriggerExecutionEntity {

    @TableId(type = IdType.AUTO)
    private Long id;
    private Long triggerId;
    private Long jobId;
    private String tenantId;

    /**
     * pending / running / succeeded / failed / cancelled
     */
    private String status;
    private Integer attempt;
    private Long startedAt;
    private Long finishedAt;

    @TableField("error_detail")
    private String error;

    /**
     * 触发时的观测数据样本（JSON）
     */
    private String eventSample;

    public Long getId() {
        return id;
    }

    public void setId(Long id) {
        this.id = id;
    }

    public Long getTriggerId() {
        return triggerId;
    }

    public void setTriggerId(Long triggerId) {
        this.triggerId = triggerId;
    }

    public Long getJobId() {
        return jobId;
    }

    public void setJobId(Long jobId) {
        this.jobId = jobId;
    }

    public String getTenantId() {
        return tenantId;
    }

    public void setTenantId(String tenantId) {
        this.tenantId = tenantId;
    }

    public String getStatus() {
        return status;
    }

    public void setStatus(String status) {
        this.status = status;
    }

    public Integer getAttempt() {
        return attempt;
    }

    public void setAttempt(Integer attempt) {
        this.attempt = attempt;
    }

    public Long getStartedAt() {
        return startedAt;
    }

    public void setStartedAt(Long startedAt) {
        this.startedAt = startedAt;
    }

    public Long getFinishedAt() {
        return finishedAt;
    }

    public void setFinishedAt(Long finishedAt) {
        this.finishedAt = finishedAt;
    }

    public String getError() {
        return error;
    }

    public void setError(String error) {
        this.error = error;
    }

    public String getEventSample() {
        return eventSample;
    }

    public void setEventSample(String eventSample) {
        this.eventSample = eventSample;
    }
}
