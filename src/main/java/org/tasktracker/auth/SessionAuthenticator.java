package org.tasktracker.auth;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tasktracker.exception.CustomException;
import org.tasktracker.exception.ErrorCode;
import org.tasktracker.repository.SessionStore;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;

/**
 * 有状态会话策略：服务端保存身份，客户端只持有不透明引用。
 */
public class SessionAuthenticator implements Authenticator {

    private static final Logger logger = LoggerFactory.getLogger(SessionAuthenticator.class);

    private static final int REFERENCE_BYTES = 32;

    private final SessionStore sessionStore;
    private final Duration ttl;
    private final Clock clock;
    private final SecureRandom random = new SecureRandom();

    public SessionAuthenticator(SessionStore sessionStore, Duration ttl, Clock clock) {
        this.sessionStore = sessionStore;
        this.ttl = ttl;
        this.clock = clock;
    }

    @Override
    public String issue(Identity identity) {
        String reference = newReference();
        Instant expiresAt = clock.instant().plus(ttl);
        sessionStore.put(reference, identity, expiresAt);
        logger.info("Session issued for user: {}, expires at {}", identity.id(), expiresAt);
        return reference;
    }

    @Override
    public Identity resolve(String presented) {
        if (presented == null || presented.isBlank()) {
            throw new CustomException(ErrorCode.UNAUTHENTICATED, "Authentication required");
        }
        return sessionStore.find(presented)
                .orElseThrow(() -> new CustomException(ErrorCode.UNAUTHENTICATED, "Authentication required"));
    }

    @Override
    public void invalidate(String presented) {
        if (presented == null || presented.isBlank()) {
            return;
        }
        sessionStore.remove(presented);
        logger.info("Session invalidated");
    }

    @Override
    public CredentialChannel channel() {
        return CredentialChannel.COOKIE;
    }

    @Override
    public Duration lifetime() {
        return ttl;
    }

    private String newReference() {
        byte[] bytes = new byte[REFERENCE_BYTES];
        random.nextBytes(bytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }
}
