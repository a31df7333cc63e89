package com.sunny.conduit.job.server.config;

import com.sunny.conduit.job.realtime.auth.RealtimeHandshake;
import com.sunny.conduit.job.realtime.hub.EventHub;
import com.sunny.conduit.job.realtime.processor.MessageProcessor;
import com.sunny.conduit.job.server.websocket.RealtimeWebSocketHandler;
import com.sunny.conduit.job.server.websocket.TokenHandshakeInterceptor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

/**
 * 实时 WebSocket 端点
 *
 * @author SunnyX6
 * @date 2026-03-07
 */
@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    @Value("${conduit.realtime.path:/ws/realtime}")
    private String path;

    @Value("${conduit.realtime.allowed-origins:*}")
    private String[] allowedOrigins;

    private final EventHub eventHub;
    private final MessageProcessor messageProcessor;
    private final RealtimeHandshake realtimeHandshake;

    public WebSocketConfig(EventHub eventHub, MessageProcessor messageProcessor, RealtimeHandshake realtimeHandshake) {
        this.eventHub = eventHub;
        this.messageProcessor = messageProcessor;
        this.realtimeHandshake = realtimeHandshake;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(new RealtimeWebSocketHandler(eventHub, messageProcessor), path)
                .addInterceptors(new TokenHandshakeInterceptor(realtimeHandshake))
                .setAllowedOriginPatterns(allowedOrigins);
    }
}
