package org.tasktracker.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.RedisTemplate;
import org.tasktracker.auth.Authenticator;
import org.tasktracker.auth.CredentialTransport;
import org.tasktracker.auth.SessionAuthenticator;
import org.tasktracker.auth.TokenAuthenticator;
import org.tasktracker.repository.InMemorySessionStore;
import org.tasktracker.repository.RedisSessionStore;
import org.tasktracker.repository.SessionStore;
import org.tasktracker.service.SessionCleanupService;
import org.tasktracker.utils.JwtUtils;

import java.time.Clock;

/**
 * 认证策略装配：启动时根据 tracker.auth.strategy 只创建一个 Authenticator，
 * 会话表作为普通 Bean 注入，不做全局静态访问。
 */
@Configuration
public class AuthConfig {

    private static final Logger logger = LoggerFactory.getLogger(AuthConfig.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnProperty(name = "tracker.auth.session.store", havingValue = "memory", matchIfMissing = true)
    public InMemorySessionStore inMemorySessionStore(Clock clock) {
        logger.info("Using in-memory session store");
        return new InMemorySessionStore(clock);
    }

    // Redis 由 TTL 回收，只有进程内会话表需要定时清理
    @Bean
    @ConditionalOnProperty(name = "tracker.auth.session.store", havingValue = "memory", matchIfMissing = true)
    public SessionCleanupService sessionCleanupService(InMemorySessionStore inMemorySessionStore) {
        return new SessionCleanupService(inMemorySessionStore);
    }

    @Bean
    @ConditionalOnProperty(name = "tracker.auth.session.store", havingValue = "redis")
    public SessionStore redisSessionStore(RedisTemplate<String, Object> redisTemplate, Clock clock) {
        logger.info("Using Redis session store");
        return new RedisSessionStore(redisTemplate, clock);
    }

    @Bean
    @ConditionalOnProperty(name = "tracker.auth.strategy", havingValue = "session", matchIfMissing = true)
    public Authenticator sessionAuthenticator(SessionStore sessionStore, TrackerProperties properties, Clock clock) {
        logger.info("Authentication strategy: stateful session");
        return new SessionAuthenticator(sessionStore, properties.getAuth().getSession().getTtl(), clock);
    }

    @Bean
    @ConditionalOnProperty(name = "tracker.auth.strategy", havingValue = "token")
    public Authenticator tokenAuthenticator(TrackerProperties properties, Clock clock) {
        logger.info("Authentication strategy: stateless token");
        TrackerProperties.Token token = properties.getAuth().getToken();
        JwtUtils jwtUtils = new JwtUtils(token.getSecretKey(), token.getIssuer(), clock);
        return new TokenAuthenticator(jwtUtils, token.getTtl(), clock);
    }

    @Bean
    public CredentialTransport credentialTransport(Authenticator authenticator, TrackerProperties properties) {
        return new CredentialTransport(authenticator.channel(), properties.getAuth().getSession());
    }
}
