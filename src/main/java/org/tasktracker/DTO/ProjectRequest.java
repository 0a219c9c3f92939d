package org.tasktracker.DTO;

/**
 * 项目创建/更新请求。更新时为 null 的字段保持原值。
 */
public record ProjectRequest(String name, String description, String status) {
}
