package org.tasktracker.utils;

import io.jsonwebtoken.*;
import io.jsonwebtoken.security.Keys;
import org.tasktracker.auth.Identity;

import javax.crypto.SecretKey;
import java.time.Clock;
import java.time.Instant;
import java.util.Base64;
import java.util.Date;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

/**
 * JWT 编解码工具，HS256 签名，时间以注入的 Clock 为准。
 */
public class JwtUtils {

    public static final String CLAIM_NAME = "name";
    public static final String CLAIM_EMAIL = "email";
    public static final String CLAIM_ROLE = "role";

    private final SecretKey signingKey;
    private final String issuer;
    private final Clock clock;

    /**
     * @param secretKeyBase64 Base64 编码后的密钥，解码后至少 256 位
     */
    public JwtUtils(String secretKeyBase64, String issuer, Clock clock) {
        if (secretKeyBase64 == null || secretKeyBase64.isBlank()) {
            throw new IllegalStateException("tracker.auth.token.secret-key must be set when the token strategy is active");
        }
        this.signingKey = getSigningKey(secretKeyBase64);
        this.issuer = issuer;
        this.clock = clock;
    }

    /**
     * 解析 Base64 密钥，并返回 SecretKey
     */
    private static SecretKey getSigningKey(String secretKeyBase64) {
        byte[] keyBytes = Base64.getDecoder().decode(secretKeyBase64);
        return Keys.hmacShaKeyFor(keyBytes);
    }

    /**
     * 生成 JWT Token，身份信息全部写入 claims
     */
    public String generateToken(Identity identity, Instant expiresAt) {
        Map<String, Object> claims = new HashMap<>();
        claims.put(CLAIM_NAME, identity.name());
        claims.put(CLAIM_EMAIL, identity.email());
        claims.put(CLAIM_ROLE, identity.role().name());

        return Jwts.builder()
                .setClaims(claims)
                .setId(generateTokenId())
                .setIssuer(issuer)
                .setSubject(identity.id().toString())
                .setIssuedAt(Date.from(clock.instant()))
                .setExpiration(Date.from(expiresAt))
                .signWith(signingKey, SignatureAlgorithm.HS256)
                .compact();
    }

    /**
     * 校验签名、签发者和过期时间后返回 claims。
     *
     * @throws ExpiredJwtException 已过期
     * @throws JwtException        签名不符或格式错误
     */
    public Claims parseClaims(String token) {
        return Jwts.parserBuilder()
                .setSigningKey(signingKey)
                .requireIssuer(issuer)
                .setClock(() -> Date.from(clock.instant()))
                .build()
                .parseClaimsJws(token)
                .getBody();
    }

    /**
     * 生成唯一的tokenId
     */
    private String generateTokenId() {
        return UUID.randomUUID().toString().replace("-", "");
    }
}
