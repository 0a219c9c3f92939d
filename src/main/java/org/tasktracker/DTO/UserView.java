package org.tasktracker.DTO;

import org.tasktracker.entity.User;

import java.time.LocalDateTime;

// 不包含 password 字段
public record UserView(Long id, String name, String email, User.Role role, LocalDateTime createdAt) {

    public static UserView from(User user) {
        return new UserView(user.getId(), user.getName(), user.getEmail(), user.getRole(), user.getCreatedAt());
    }
}
