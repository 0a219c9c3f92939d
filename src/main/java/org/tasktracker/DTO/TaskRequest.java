package org.tasktracker.DTO;

/**
 * 任务创建/更新请求。更新时为 null 的字段保持原值。
 */
public record TaskRequest(String title, String description, Long assignedUserId, String priority, String status) {
}
