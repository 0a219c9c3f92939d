package org.tasktracker.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.serializer.GenericJackson2JsonRedisSerializer;
import org.springframework.data.redis.serializer.StringRedisSerializer;

/**
 * 会话表使用 Redis 时的模板配置。连接是惰性的，未启用 Redis 会话表时不会建立连接。
 */
@Configuration
public class RedisConfig {

    @Bean
    public RedisTemplate<String, Object> redisTemplate(RedisConnectionFactory connectionFactory) {
        RedisTemplate<String, Object> template = new RedisTemplate<>();
        template.setConnectionFactory(connectionFactory);
        // key 用明文字符串，便于在 Redis 中按 tracker:session: 前缀排查
        template.setKeySerializer(new StringRedisSerializer());
        // value 存 JSON，会话信息是简单的 Map
        template.setValueSerializer(new GenericJackson2JsonRedisSerializer());
        return template;
    }
}
