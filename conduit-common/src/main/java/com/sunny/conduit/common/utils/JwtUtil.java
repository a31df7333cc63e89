package com.sunny.conduit.common.utils;

import com.sunny.conduit.common.constant.ErrorType;
import com.sunny.conduit.common.exception.BadRequestException;
import com.sunny.conduit.common.exception.UnauthorizedException;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.JwtParserBuilder;
import io.jsonwebtoken.Jwts;
import java.nio.charset.StandardCharsets;
import java.util.Date;
import java.util.Map;
import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;

/**
 * JWT工具类
 * 签发与校验 HMAC 身份令牌，解析租户与用户声明
 *
 * @author Sunny
 * @date 2026-03-02
 */
public class JwtUtil {

    public static final String CLAIM_TENANT_ID = "tenantId";
    public static final String CLAIM_USERNAME = "username";

    private final SecretKey key;
    private final String issuer;

    public JwtUtil(String secret, String issuer) {
        if (secret == null || secret.length() < 32) {
            throw new IllegalArgumentException("JWT 密钥长度至少 32 位");
        }
        this.key = new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), "HmacSHA256");
        this.issuer = issuer;
    }

    public String sign(Map<String, Object> claims, String subject, Date issuedAt, Date expiration) {
        if (claims == null || subject == null || issuedAt == null || expiration == null) {
            throw new BadRequestException("参数错误");
        }
        var builder = Jwts.builder()
                .claims(claims)
                .subject(subject)
                .issuedAt(issuedAt)
                .expiration(expiration);
        if (issuer != null && !issuer.isBlank()) {
            builder.issuer(issuer);
        }
        return builder.signWith(key).compact();
    }

    /**
     * 校验签名与有效期并返回声明
     * <p>
     * 配置了 issuer 时同时校验签发方
     *
     * @throws UnauthorizedException 令牌为空、非法或已过期
     */
    public Claims parseToken(String token) {
        if (token == null || token.isBlank()) {
            throw new UnauthorizedException(ErrorType.TOKEN_INVALID, null, "Token为空");
        }
        try {
            JwtParserBuilder parser = Jwts.parser().verifyWith(key);
            if (issuer != null && !issuer.isBlank()) {
                parser = parser.requireIssuer(issuer);
            }
            return parser.build().parseSignedClaims(token).getPayload();
        } catch (ExpiredJwtException e) {
            throw new UnauthorizedException(ErrorType.TOKEN_EXPIRED, null, "Token已过期");
        } catch (JwtException | IllegalArgumentException e) {
            throw new UnauthorizedException(ErrorType.TOKEN_INVALID, null, "Token无效: %s", e.getMessage());
        }
    }

    public boolean isValid(String token) {
        try {
            parseToken(token);
            return true;
        } catch (UnauthorizedException e) {
            return false;
        }
    }

    public Long getUserId(Claims claims) {
        if (claims == null) {
            return null;
        }
        return parseLong(claims.getSubject());
    }

    public Long getTenantId(Claims claims) {
        if (claims == null) {
            return null;
        }
        return parseLong(claims.get(CLAIM_TENANT_ID));
    }

    public String getUsername(Claims claims) {
        if (claims == null) {
            return null;
        }
        return claims.get(CLAIM_USERNAME, String.class);
    }

    private Long parseLong(Object value) {
        if (value instanceof Number number) {
            return number.longValue();
        }
        if (value instanceof String text) {
            try {
                return Long.parseLong(text);
            } catch (NumberFormatException ex) {
                return null;
            }
        }
        return null;
    }
}
