package com.sunny.conduit.job.server.websocket;

import com.sunny.conduit.job.realtime.hub.ClientConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;

/**
 * WebSocketSession 适配为 Hub 连接
 *
 * @author SunnyX6
 * @date 2026-03-07
 */
public class WebSocketClientConnection implements ClientConnection {

    private static final Logger log = LoggerFactory.getLogger(WebSocketClientConnection.class);

    /**
     * 关闭原因最长 123 字节
     */
    private static final int MAX_REASON_LENGTH = 120;

    private final WebSocketSession session;

    public WebSocketClientConnection(WebSocketSession session) {
        this.session = session;
    }

    @Override
    public String id() {
        return session.getId();
    }

    @Override
    public void send(String text) throws IOException {
        session.sendMessage(new TextMessage(text));
    }

    @Override
    public void close(String reason) {
        if (!session.isOpen()) {
            return;
        }
        String text = reason == null ? "" : reason;
        if (text.length() > MAX_REASON_LENGTH) {
            text = text.substring(0, MAX_REASON_LENGTH);
        }
        try {
            session.close(CloseStatus.POLICY_VIOLATION.withReason(text));
        } catch (IOException e) {
            log.debug("关闭 WebSocket 连接失败: sessionId={}, error={}", session.getId(), e.getMessage());
        }
    }

    @Override
    public boolean isOpen() {
        return session.isOpen();
    }
}
