package org.tasktracker.repository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.RedisTemplate;
import org.tasktracker.auth.Identity;
import org.tasktracker.entity.User;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * 基于 Redis 的会话表，多实例部署时共享会话。
 * Redis TTL 负责回收，读取时再按时钟校验一次过期时间。
 */
public class RedisSessionStore implements SessionStore {

    private static final Logger logger = LoggerFactory.getLogger(RedisSessionStore.class);

    // Redis key前缀
    private static final String SESSION_PREFIX = "tracker:session:";

    private final RedisTemplate<String, Object> redisTemplate;
    private final Clock clock;

    public RedisSessionStore(RedisTemplate<String, Object> redisTemplate, Clock clock) {
        this.redisTemplate = redisTemplate;
        this.clock = clock;
    }

    @Override
    public void put(String reference, Identity identity, Instant expiresAt) {
        Duration ttl = Duration.between(clock.instant(), expiresAt);
        if (ttl.isNegative() || ttl.isZero()) {
            return;
        }
        Map<String, Object> sessionInfo = new HashMap<>();
        sessionInfo.put("userId", identity.id());
        sessionInfo.put("name", identity.name());
        sessionInfo.put("email", identity.email());
        sessionInfo.put("role", identity.role().name());
        sessionInfo.put("expireTime", expiresAt.toEpochMilli());

        redisTemplate.opsForValue().set(SESSION_PREFIX + reference, sessionInfo, ttl);
        logger.debug("Session cached for user: {}", identity.id());
    }

    @Override
    @SuppressWarnings("unchecked")
    public Optional<Identity> find(String reference) {
        String key = SESSION_PREFIX + reference;
        Object value = redisTemplate.opsForValue().get(key);
        if (!(value instanceof Map)) {
            return Optional.empty();
        }
        Map<String, Object> sessionInfo = (Map<String, Object>) value;
        Object expireTime = sessionInfo.get("expireTime");
        if (!(expireTime instanceof Number) || clock.millis() >= ((Number) expireTime).longValue()) {
            redisTemplate.delete(key);
            return Optional.empty();
        }
        // JSON 反序列化后数字可能是 Integer 或 Long
        Object userId = sessionInfo.get("userId");
        Object role = sessionInfo.get("role");
        if (!(userId instanceof Number) || !(role instanceof String)) {
            logger.warn("Discarding malformed session entry");
            redisTemplate.delete(key);
            return Optional.empty();
        }
        try {
            return Optional.of(new Identity(
                    ((Number) userId).longValue(),
                    (String) sessionInfo.get("name"),
                    (String) sessionInfo.get("email"),
                    User.Role.valueOf((String) role)));
        } catch (IllegalArgumentException e) {
            logger.warn("Discarding session entry with unknown role: {}", role);
            redisTemplate.delete(key);
            return Optional.empty();
        }
    }

    @Override
    public void remove(String reference) {
        redisTemplate.delete(SESSION_PREFIX + reference);
        logger.debug("Session removed from cache");
    }
}
