package org.tasktracker.DTO;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.tasktracker.entity.Project;

import java.time.LocalDateTime;
import java.util.List;

public record ProjectView(Long id,
                          String name,
                          String description,
                          String status,
                          Long managerId,
                          UserSummary manager,
                          // 只有查询单个项目时才带出任务列表
                          @JsonInclude(JsonInclude.Include.NON_NULL) List<TaskView> tasks,
                          LocalDateTime createdAt,
                          LocalDateTime updatedAt) {

    public static ProjectView from(Project project) {
        return from(project, null);
    }

    public static ProjectView from(Project project, List<TaskView> tasks) {
        return new ProjectView(
                project.getId(),
                project.getName(),
                project.getDescription(),
                project.getStatus(),
                project.getManager().getId(),
                UserSummary.from(project.getManager()),
                tasks,
                project.getCreatedAt(),
                project.getUpdatedAt());
    }
}
