package org.tasktracker.entity;

import com.fasterxml.jackson.annotation.JsonValue;
import jakarta.persistence.*;
import lombok.Data;
import lombok.ToString;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;
import org.tasktracker.exception.CustomException;
import org.tasktracker.exception.ErrorCode;
import org.tasktracker.utils.ValidationUtils;

import java.time.LocalDateTime;
import java.util.Locale;

@Data
@Entity
@Table(name = "users", uniqueConstraints = @UniqueConstraint(name = "uk_users_email", columnNames = "email"))
public class User {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = ValidationUtils.TEXT_MAX_LENGTH)
    private String name;

    // 邮箱按原样存储和比较，区分大小写
    @Column(nullable = false, unique = true, length = ValidationUtils.TEXT_MAX_LENGTH)
    private String email;

    // BCrypt 哈希，绝不对外输出
    @ToString.Exclude
    @Column(nullable = false)
    private String password;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private Role role = Role.EMPLOYEE;

    @CreationTimestamp
    private LocalDateTime createdAt;

    @UpdateTimestamp
    private LocalDateTime updatedAt;

    /**
     * 角色层级：EMPLOYEE < MANAGER < ADMIN，按声明顺序比较。
     */
    public enum Role {
        EMPLOYEE, MANAGER, ADMIN;

        public boolean isAtLeast(Role required) {
            return compareTo(required) >= 0;
        }

        @JsonValue
        public String value() {
            return name().toLowerCase(Locale.ROOT);
        }

        /**
         * 解析外部传入的角色字符串，未知值视为校验错误。
         */
        public static Role parse(String raw) {
            if (raw == null) {
                return null;
            }
            for (Role role : values()) {
                if (role.value().equals(raw.trim().toLowerCase(Locale.ROOT))) {
                    return role;
                }
            }
            throw new CustomException(ErrorCode.VALIDATION_ERROR,
                    "Invalid role '" + raw + "', expected one of employee, manager, admin");
        }
    }
}
