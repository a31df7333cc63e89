package com.sunny.conduit.job.server.websocket;

import com.sunny.conduit.job.realtime.auth.RealtimeIdentity;
import com.sunny.conduit.job.realtime.hub.ConnectionHandle;
import com.sunny.conduit.job.realtime.hub.EventHub;
import com.sunny.conduit.job.realtime.processor.MessageProcessor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

/**
 * 实时连接处理
 * <p>
 * 握手通过后注册到 EventHub，入站文本交给 MessageProcessor，断开时注销
 *
 * @author SunnyX6
 * @date 2026-03-07
 */
public class RealtimeWebSocketHandler extends TextWebSocketHandler {

    private static final Logger log = LoggerFactory.getLogger(RealtimeWebSocketHandler.class);

    static final String ATTR_HANDLE = "conduit.handle";

    private final EventHub eventHub;
    private final MessageProcessor messageProcessor;

    public RealtimeWebSocketHandler(EventHub eventHub, MessageProcessor messageProcessor) {
        this.eventHub = eventHub;
        this.messageProcessor = messageProcessor;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) throws Exception {
        Object identity = session.getAttributes().get(TokenHandshakeInterceptor.ATTR_IDENTITY);
        if (!(identity instanceof RealtimeIdentity realtimeIdentity)) {
            log.warn("连接缺少认证信息，关闭: sessionId={}", session.getId());
            session.close(CloseStatus.POLICY_VIOLATION.withReason("unauthorized"));
            return;
        }
        ConnectionHandle handle = eventHub.register(new WebSocketClientConnection(session), realtimeIdentity.tenantId());
        session.getAttributes().put(ATTR_HANDLE, handle);
        log.info("实时连接建立: sessionId={}, tenantId={}, userId={}",
                session.getId(), realtimeIdentity.tenantId(), realtimeIdentity.userId());
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        ConnectionHandle handle = (ConnectionHandle) session.getAttributes().get(ATTR_HANDLE);
        if (handle == null) {
            return;
        }
        messageProcessor.handle(handle, message.getPayload());
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.warn("实时连接传输异常: sessionId={}, error={}", session.getId(), exception.getMessage());
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        ConnectionHandle handle = (ConnectionHandle) session.getAttributes().remove(ATTR_HANDLE);
        if (handle != null) {
            eventHub.unregister(handle);
            log.info("实时连接断开: sessionId={}, tenantId={}, status={}",
                    session.getId(), handle.tenantId(), status.getCode());
        }
    }
}
