package org.tasktracker.auth;

import org.tasktracker.entity.User;

/**
 * 已认证调用方的身份快照，签发时从用户记录复制，之后不再回查数据库。
 */
public record Identity(Long id, String name, String email, User.Role role) {

    public static Identity of(User user) {
        return new Identity(user.getId(), user.getName(), user.getEmail(), user.getRole());
    }
}
