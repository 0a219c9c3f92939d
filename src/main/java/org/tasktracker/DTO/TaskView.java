package org.tasktracker.DTO;

import org.tasktracker.entity.Task;

import java.time.LocalDateTime;

public record TaskView(Long id,
                       String title,
                       String description,
                       Long projectId,
                       Long assignedUserId,
                       UserSummary assignedUser,
                       Task.Priority priority,
                       String status,
                       LocalDateTime createdAt,
                       LocalDateTime updatedAt) {

    /**
     * 必须在事务内调用，assignedUser 可能是懒加载代理。
     */
    public static TaskView from(Task task) {
        return new TaskView(
                task.getId(),
                task.getTitle(),
                task.getDescription(),
                task.getProject().getId(),
                task.getAssignedUser() != null ? task.getAssignedUser().getId() : null,
                UserSummary.from(task.getAssignedUser()),
                task.getPriority(),
                task.getStatus(),
                task.getCreatedAt(),
                task.getUpdatedAt());
    }
}
