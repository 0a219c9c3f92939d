package org.tasktracker.utils;

import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;

/**
 * 密码哈希工具，BCrypt 单向加密 + 校验。
 */
public class PasswordUtils {
    private static final BCryptPasswordEncoder encoder = new BCryptPasswordEncoder();

    // 用户不存在时也做一次同等代价的比较，使两种登录失败耗时接近
    private static final String UNKNOWN_USER_HASH = encoder.encode("unknown-user-placeholder");

    private PasswordUtils() {
    }

    /**
     * 加密密码
     *
     * @param rawPassword 明文密码
     * @return 加密后的密码
     */
    public static String encode(String rawPassword) {
        return encoder.encode(rawPassword);
    }

    /**
     * 验证密码是否匹配，任一参数为空都视为不匹配
     *
     * @param rawPassword     明文密码
     * @param encodedPassword 加密后的密码
     * @return 是否匹配
     */
    public static boolean matches(String rawPassword, String encodedPassword) {
        if (rawPassword == null || encodedPassword == null) {
            return false;
        }
        return encoder.matches(rawPassword, encodedPassword);
    }

    /**
     * 针对不存在的账号执行一次比较，结果恒为 false。
     */
    public static boolean matchesUnknownUser(String rawPassword) {
        matches(rawPassword == null ? "" : rawPassword, UNKNOWN_USER_HASH);
        return false;
    }
}
