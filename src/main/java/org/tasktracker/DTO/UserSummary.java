package org.tasktracker.DTO;

import org.tasktracker.entity.User;

/**
 * 关联查询时内嵌的用户摘要（项目经理、任务负责人）。
 */
public record UserSummary(Long id, String name, String email) {

    public static UserSummary from(User user) {
        return user == null ? null : new UserSummary(user.getId(), user.getName(), user.getEmail());
    }
}
