package org.tasktracker.entity;

import com.fasterxml.jackson.annotation.JsonValue;
import jakarta.persistence.*;
import lombok.Data;
import lombok.EqualsAndHashCode;
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
@Table(name = "tasks", indexes = {
        @Index(name = "idx_tasks_project_id", columnList = "project_id"),
        @Index(name = "idx_tasks_assigned_user_id", columnList = "assigned_user_id")
})
public class Task {

    public static final String DEFAULT_STATUS = "pending";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = ValidationUtils.TEXT_MAX_LENGTH)
    private String title;

    @Column(columnDefinition = "TEXT")
    private String description;

    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "project_id", nullable = false)
    private Project project;

    // 可为空：任务可以暂不指派
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "assigned_user_id")
    private User assignedUser;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private Priority priority = Priority.MEDIUM;

    @Column(nullable = false, length = ValidationUtils.STATUS_MAX_LENGTH)
    private String status = DEFAULT_STATUS;

    @CreationTimestamp
    private LocalDateTime createdAt;

    @UpdateTimestamp
    private LocalDateTime updatedAt;

    public enum Priority {
        LOW, MEDIUM, HIGH;

        @JsonValue
        public String value() {
            return name().toLowerCase(Locale.ROOT);
        }

        public static Priority parse(String raw) {
            if (raw == null) {
                return null;
            }
            for (Priority priority : values()) {
                if (priority.value().equals(raw.trim().toLowerCase(Locale.ROOT))) {
                    return priority;
                }
            }
            throw new CustomException(ErrorCode.VALIDATION_ERROR,
                    "Invalid priority '" + raw + "', expected one of low, medium, high");
        }
    }
}
