package com.sunny.conduit.job.server.websocket;

import com.sunny.conduit.common.exception.UnauthorizedException;
import com.sunny.conduit.job.realtime.auth.RealtimeHandshake;
import com.sunny.conduit.job.realtime.auth.RealtimeIdentity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.server.ServerHttpRequest;
import org.springframework.http.server.ServerHttpResponse;
import org.springframework.web.socket.WebSocketHandler;
import org.springframework.web.socket.server.HandshakeInterceptor;

import java.util.Map;

/**
 * WebSocket 握手认证
 * <p>
 * 认证失败直接返回 401，连接不会建立，也不会注册到 Hub
 *
 * @author SunnyX6
 * @date 2026-03-07
 */
public class TokenHandshakeInterceptor implements HandshakeInterceptor {

    private static final Logger log = LoggerFactory.getLogger(TokenHandshakeInterceptor.class);

    public static final String ATTR_IDENTITY = "conduit.identity";

    private final RealtimeHandshake handshake;

    public TokenHandshakeInterceptor(RealtimeHandshake handshake) {
        this.handshake = handshake;
    }

    @Override
    public boolean beforeHandshake(ServerHttpRequest request,
                                   ServerHttpResponse response,
                                   WebSocketHandler wsHandler,
                                   Map<String, Object> attributes) {
        String token = RealtimeHandshake.resolveToken(
                request.getURI().getRawQuery(),
                request.getHeaders().getFirst(HttpHeaders.AUTHORIZATION));
        try {
            RealtimeIdentity identity = handshake.authenticate(token);
            attributes.put(ATTR_IDENTITY, identity);
            return true;
        } catch (UnauthorizedException e) {
            log.info("实时连接认证失败: remote={}, type={}, message={}",
                    request.getRemoteAddress(), e.getType(), e.getMessage());
            response.setStatusCode(HttpStatus.UNAUTHORIZED);
            return false;
        }
    }

    @Override
    public void afterHandshake(ServerHttpRequest request,
                               ServerHttpResponse response,
                               WebSocketHandler wsHandler,
                               Exception exception) {
        if (exception != null) {
            log.warn("实时连接握手异常: remote={}, error={}", request.getRemoteAddress(), exception.getMessage());
        }
    }
}
