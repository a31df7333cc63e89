package com.sunny.conduit.job.realtime.processor;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.sunny.conduit.job.core.message.JobEvent;

import java.util.List;

/**
 * 只发给指令发送方的回复
 *
 * @author SunnyX6
 * @date 2026-03-06
 */
public sealed interface ServerMessage {

    String TYPE_ACK = "ack";
    String TYPE_PONG = "pong";
    String TYPE_JOB_SNAPSHOT = "job_snapshot";
    String TYPE_ERROR = "error";

    String type();

    /**
     * 指令已受理
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    record Ack(String type, String command, Long executionId, Long triggerId, Long jobId, String status,
               long timestamp) implements ServerMessage {

        public Ack(String command, Long executionId, Long triggerId, Long jobId, String status, long timestamp) {
            this(TYPE_ACK, command, executionId, triggerId, jobId, status, timestamp);
        }
    }

    record Pong(String type, long timestamp) implements ServerMessage {

        public Pong(long timestamp) {
            this(TYPE_PONG, timestamp);
        }
    }

    /**
     * 任务最近执行记录快照，按开始时间倒序
     */
    record JobSnapshot(String type, long jobId, List<JobEvent> executions, long timestamp) implements ServerMessage {

        public JobSnapshot(long jobId, List<JobEvent> executions, long timestamp) {
            this(TYPE_JOB_SNAPSHOT, jobId, executions, timestamp);
        }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record ErrorReply(String type, int code, String errorType, String message, String command,
                      long timestamp) implements ServerMessage {

        public ErrorReply(int code, String errorType, String message, String command, long timestamp) {
            this(TYPE_ERROR, code, errorType, message, command, timestamp);
        }
    }
}
