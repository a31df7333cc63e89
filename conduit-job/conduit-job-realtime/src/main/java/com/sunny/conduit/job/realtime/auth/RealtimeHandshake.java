package com.sunny.conduit.job.realtime.auth;

import com.sunny.conduit.common.constant.ErrorType;
import com.sunny.conduit.common.exception.UnauthorizedException;
import com.sunny.conduit.common.utils.JwtUtil;
import io.jsonwebtoken.Claims;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;

/**
 * 实时连接握手认证
 * <p>
 * 令牌取自 token 查询参数或 Authorization: Bearer 请求头，校验失败的连接不会注册到 Hub
 *
 * @author SunnyX6
 * @date 2026-03-06
 */
public class RealtimeHandshake {

    private static final String BEARER_PREFIX = "Bearer ";
    private static final String TOKEN_PARAM = "token=";

    private final JwtUtil jwtUtil;

    public RealtimeHandshake(JwtUtil jwtUtil) {
        this.jwtUtil = jwtUtil;
    }

    /**
     * 校验令牌并解析身份
     *
     * @throws UnauthorizedException 令牌缺失、非法、过期或不含租户
     */
    public RealtimeIdentity authenticate(String token) {
        Claims claims = jwtUtil.parseToken(token);
        Object tenant = claims.get(JwtUtil.CLAIM_TENANT_ID);
        if (tenant == null || tenant.toString().isBlank()) {
            throw new UnauthorizedException(ErrorType.TENANT_MISSING, null, "Token缺少租户信息");
        }
        return new RealtimeIdentity(tenant.toString(), jwtUtil.getUserId(claims), jwtUtil.getUsername(claims));
    }

    /**
     * 从查询串与请求头中取令牌，查询参数优先
     *
     * @param query               原始查询串，可为 null
     * @param authorizationHeader Authorization 请求头，可为 null
     * @return 令牌，不存在时返回 null
     */
    public static String resolveToken(String query, String authorizationHeader) {
        if (query != null) {
            for (String pair : query.split("&")) {
                if (pair.startsWith(TOKEN_PARAM) && pair.length() > TOKEN_PARAM.length()) {
                    return URLDecoder.decode(pair.substring(TOKEN_PARAM.length()), StandardCharsets.UTF_8);
                }
            }
        }
        if (authorizationHeader != null && authorizationHeader.startsWith(BEARER_PREFIX)) {
            String token = authorizationHeader.substring(BEARER_PREFIX.length()).trim();
            return token.isEmpty() ? null : token;
        }
        return null;
    }
}
