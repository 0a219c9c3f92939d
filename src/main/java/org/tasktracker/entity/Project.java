package org.tasktracker.entity;

import jakarta.persistence.*;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.ToString;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;
import org.tasktracker.utils.ValidationUtils;

import java.time.LocalDateTime;

@Data
@Entity
@Table(name = "projects", indexes = {
        @Index(name = "idx_projects_manager_id", columnList = "manager_id")
})
public class Project {

    public static final String DEFAULT_STATUS = "active";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = ValidationUtils.TEXT_MAX_LENGTH)
    private String name;

    @Column(columnDefinition = "TEXT")
    private String description;

    // 自由格式的状态字符串
    @Column(nullable = false, length = ValidationUtils.STATUS_MAX_LENGTH)
    private String status = DEFAULT_STATUS;

    // 创建者即项目经理
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "manager_id", nullable = false)
    private User manager;

    @CreationTimestamp
    private LocalDateTime createdAt;

    @UpdateTimestamp
    private LocalDateTime updatedAt;
}
