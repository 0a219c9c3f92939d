package org.tasktracker.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * 全局配置：认证策略、会话与令牌参数、初始管理员账号。
 */
@Component
@ConfigurationProperties(prefix = "tracker")
@Data
public class TrackerProperties {

    private Auth auth = new Auth();
    private Admin admin = new Admin();

    @Data
    public static class Auth {
        /** session 或 token */
        private String strategy = "session";
        private Session session = new Session();
        private Token token = new Token();
    }

    @Data
    public static class Session {
        /** 会话绝对有效期 */
        private Duration ttl = Duration.ofHours(24);
        private String cookieName = "TRACKER_SESSION";
        private boolean cookieSecure = false;
        /** memory 或 redis */
        private String store = "memory";
        /** 进程内会话表的过期清理间隔 */
        private Duration purgeInterval = Duration.ofMinutes(10);
    }

    @Data
    public static class Token {
        /** Base64 编码的 HS256 密钥 */
        private String secretKey;
        private Duration ttl = Duration.ofHours(24);
        private String issuer = "task-tracker";
    }

    @Data
    public static class Admin {
        /** 为空时不创建初始管理员 */
        private String email;
        private String name = "Administrator";
        private String password;
    }
}
