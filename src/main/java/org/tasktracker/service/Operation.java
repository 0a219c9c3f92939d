package org.tasktracker.service;

import org.tasktracker.entity.User.Role;

/**
 * 每个受保护接口对应一种操作，操作决定最低角色。
 * 删除项目仅限管理员；更新任务对所有已认证用户开放。
 */
public enum Operation {
    LOGOUT(Role.EMPLOYEE),
    READ_OWN_PROFILE(Role.EMPLOYEE),
    LIST_PROJECTS(Role.EMPLOYEE),
    READ_PROJECT(Role.EMPLOYEE),
    LIST_TASKS(Role.EMPLOYEE),
    UPDATE_TASK(Role.EMPLOYEE),

    CREATE_PROJECT(Role.MANAGER),
    UPDATE_PROJECT(Role.MANAGER),
    CREATE_TASK(Role.MANAGER),
    DELETE_TASK(Role.MANAGER),

    DELETE_PROJECT(Role.ADMIN),
    LIST_USERS(Role.ADMIN);

    private final Role minimumRole;

    Operation(Role minimumRole) {
        this.minimumRole = minimumRole;
    }

    public Role getMinimumRole() {
        return minimumRole;
    }
}
