package com.sunny.conduit.job.realtime.processor;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sunny.conduit.common.constant.Code;
import com.sunny.conduit.common.constant.ErrorType;
import com.sunny.conduit.common.exception.BadRequestException;
import com.sunny.conduit.common.exception.ConduitRuntimeException;
import com.sunny.conduit.job.core.message.JobEvent;
import com.sunny.conduit.job.core.model.TriggerExecution;
import com.sunny.conduit.job.core.spi.ExecutionStore;
import com.sunny.conduit.job.core.spi.JobCommandGateway;
import com.sunny.conduit.job.realtime.hub.ConnectionHandle;
import com.sunny.conduit.job.realtime.hub.EventHub;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;

/**
 * 客户端指令处理
 * <p>
 * 解析 {command, payload}，调用调度器或查询执行记录，回复只发给发送方。
 * 校验失败与业务异常都转换为 error 回复，不会影响连接本身
 *
 * @author SunnyX6
 * @date 2026-03-06
 */
public class MessageProcessor {

    private static final Logger log = LoggerFactory.getLogger(MessageProcessor.class);

    private final EventHub eventHub;
    private final JobCommandGateway commandGateway;
    private final ExecutionStore executionStore;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final int snapshotLimit;

    public MessageProcessor(EventHub eventHub,
                            JobCommandGateway commandGateway,
                            ExecutionStore executionStore,
                            ObjectMapper objectMapper,
                            Clock clock,
                            int snapshotLimit) {
        this.eventHub = eventHub;
        this.commandGateway = commandGateway;
        this.executionStore = executionStore;
        this.objectMapper = objectMapper;
        this.clock = clock == null ? Clock.systemUTC() : clock;
        this.snapshotLimit = snapshotLimit > 0 ? snapshotLimit : 20;
    }

    /**
     * 处理一条入站文本并把回复发回该连接
     */
    public void handle(ConnectionHandle handle, String text) {
        eventHub.sendTo(handle, process(handle.tenantId(), text));
    }

    /**
     * 处理一条入站文本
     *
     * @param tenantId 发送方租户
     * @param text     原始文本
     * @return 回复消息
     */
    public ServerMessage process(String tenantId, String text) {
        ClientCommand command = null;
        try {
            command = parse(text);
            return dispatch(tenantId, command);
        } catch (ConduitRuntimeException e) {
            log.info("指令处理失败: tenantId={}, command={}, type={}, message={}",
                    tenantId, command == null ? null : command.command(), e.getType(), e.getMessage());
            return new ServerMessage.ErrorReply(e.getCode(), e.getType(), e.getMessage(),
                    command == null ? null : command.command(), clock.millis());
        } catch (RuntimeException e) {
            log.error("指令处理异常: tenantId={}, command={}",
                    tenantId, command == null ? null : command.command(), e);
            return new ServerMessage.ErrorReply(Code.INTERNAL_ERROR, ErrorType.INTERNAL_ERROR, "服务内部错误",
                    command == null ? null : command.command(), clock.millis());
        }
    }

    private ServerMessage dispatch(String tenantId, ClientCommand command) {
        CommandType type = CommandType.of(command.command());
        if (type == null) {
            throw new BadRequestException(ErrorType.COMMAND_UNKNOWN, null, "未知指令: %s", command.command());
        }
        long now = clock.millis();
        return switch (type) {
            case START_JOB -> {
                long triggerId = requireId(command, "triggerId");
                TriggerExecution execution = commandGateway.fireNow(triggerId, tenantId);
                log.info("客户端手动执行: tenantId={}, triggerId={}, executionId={}",
                        tenantId, triggerId, execution.id());
                yield new ServerMessage.Ack(type.getCode(), execution.id(), execution.triggerId(),
                        execution.jobId(), execution.status().getCode(), now);
            }
            case CANCEL_EXECUTION -> {
                long executionId = requireId(command, "executionId");
                commandGateway.cancel(executionId, tenantId);
                log.info("客户端取消执行: tenantId={}, executionId={}", tenantId, executionId);
                yield new ServerMessage.Ack(type.getCode(), executionId, null, null, null, now);
            }
            case SUBSCRIBE_JOB -> {
                long jobId = requireId(command, "jobId");
                List<JobEvent> executions = executionStore.listRecentExecutions(jobId, tenantId, snapshotLimit)
                        .stream()
                        .map(execution -> JobEvent.of(execution, now))
                        .toList();
                yield new ServerMessage.JobSnapshot(jobId, executions, now);
            }
            case PING -> new ServerMessage.Pong(now);
        };
    }

    private ClientCommand parse(String text) {
        if (text == null || text.isBlank()) {
            throw new BadRequestException(ErrorType.COMMAND_INVALID, null, "消息不能为空");
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(text);
        } catch (JsonProcessingException e) {
            throw new BadRequestException(ErrorType.COMMAND_INVALID, null, "消息不是合法的 JSON");
        }
        if (root == null || !root.isObject()) {
            throw new BadRequestException(ErrorType.COMMAND_INVALID, null, "消息必须是 JSON 对象");
        }
        JsonNode command = root.get("command");
        if (command == null || !command.isTextual() || command.asText().isBlank()) {
            throw new BadRequestException(ErrorType.COMMAND_INVALID, null, "缺少 command 字段");
        }
        JsonNode payload = root.get("payload");
        return new ClientCommand(command.asText(), payload == null || payload.isNull() ? null : payload);
    }

    private static long requireId(ClientCommand command, String field) {
        JsonNode value = command.payload() == null ? null : command.payload().get(field);
        long id = 0;
        if (value != null && value.canConvertToLong() && value.isIntegralNumber()) {
            id = value.asLong();
        } else if (value != null && value.isTextual()) {
            try {
                id = Long.parseLong(value.asText().trim());
            } catch (NumberFormatException e) {
                throw new BadRequestException(ErrorType.COMMAND_INVALID, null, "%s 必须是正整数", field);
            }
        }
        if (id <= 0) {
            throw new BadRequestException(ErrorType.COMMAND_INVALID, null, "%s 必须是正整数", field);
        }
        return id;
    }
}
