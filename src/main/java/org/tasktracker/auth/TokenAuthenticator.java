package org.tasktracker.auth;

import io.jsonwebtoken.ClaimJwtException;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.security.SecurityException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tasktracker.entity.User;
import org.tasktracker.exception.CustomException;
import org.tasktracker.exception.ErrorCode;
import org.tasktracker.utils.JwtUtils;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * 无状态令牌策略：身份和过期时间写在签名令牌里，服务端不保存任何状态。
 * 登出不会让令牌提前失效，令牌一直有效到自身的过期时间。
 */
public class TokenAuthenticator implements Authenticator {

    private static final Logger logger = LoggerFactory.getLogger(TokenAuthenticator.class);

    private final JwtUtils jwtUtils;
    private final Duration ttl;
    private final Clock clock;

    public TokenAuthenticator(JwtUtils jwtUtils, Duration ttl, Clock clock) {
        this.jwtUtils = jwtUtils;
        this.ttl = ttl;
        this.clock = clock;
    }

    @Override
    public String issue(Identity identity) {
        Instant expiresAt = clock.instant().plus(ttl);
        String token = jwtUtils.generateToken(identity, expiresAt);
        logger.info("Token generated for user: {}, expires at {}", identity.id(), expiresAt);
        return token;
    }

    @Override
    public Identity resolve(String presented) {
        if (presented == null || presented.isBlank()) {
            throw new CustomException(ErrorCode.UNAUTHENTICATED, "Authentication required");
        }
        Claims claims;
        try {
            claims = jwtUtils.parseClaims(presented);
        } catch (ExpiredJwtException e) {
            logger.debug("Token expired: {}", e.getClaims().getId());
            throw new CustomException(ErrorCode.INVALID_OR_EXPIRED_TOKEN, "Invalid or expired token");
        } catch (SecurityException | ClaimJwtException e) {
            // 签名不符，或签名有效但签发方、生效时间不符
            logger.debug("Token rejected: {}", e.getMessage());
            throw new CustomException(ErrorCode.INVALID_OR_EXPIRED_TOKEN, "Invalid or expired token");
        } catch (JwtException | IllegalArgumentException e) {
            // 无法解析的凭证等同于没有携带凭证
            logger.debug("Unparseable token: {}", e.getMessage());
            throw new CustomException(ErrorCode.UNAUTHENTICATED, "Authentication required");
        }
        return toIdentity(claims);
    }

    @Override
    public void invalidate(String presented) {
        // 无服务端状态，登出是空操作
        logger.debug("Logout requested for stateless token; token stays valid until it expires");
    }

    @Override
    public CredentialChannel channel() {
        return CredentialChannel.BEARER;
    }

    @Override
    public Duration lifetime() {
        return ttl;
    }

    private Identity toIdentity(Claims claims) {
        try {
            Long id = Long.valueOf(claims.getSubject());
            String role = claims.get(JwtUtils.CLAIM_ROLE, String.class);
            return new Identity(id,
                    claims.get(JwtUtils.CLAIM_NAME, String.class),
                    claims.get(JwtUtils.CLAIM_EMAIL, String.class),
                    User.Role.valueOf(role));
        } catch (RuntimeException e) {
            // 签名正确但 claims 不完整，同样按无效令牌处理
            logger.warn("Signed token carries unusable claims: {}", e.getMessage());
            throw new CustomException(ErrorCode.INVALID_OR_EXPIRED_TOKEN, "Invalid or expired token");
        }
    }
}
