package org.tasktracker.service;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.tasktracker.entity.User.Role;
import org.tasktracker.exception.CustomException;
import org.tasktracker.exception.ErrorCode;

import java.util.EnumSet;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.tasktracker.service.Operation.*;

class AuthorizationGuardTest {

    private static final Set<Operation> EMPLOYEE_ALLOWED = EnumSet.of(
            LOGOUT, READ_OWN_PROFILE, LIST_PROJECTS, READ_PROJECT, LIST_TASKS, UPDATE_TASK);

    private static final Set<Operation> MANAGER_ALLOWED = EnumSet.of(
            LOGOUT, READ_OWN_PROFILE, LIST_PROJECTS, READ_PROJECT, LIST_TASKS, UPDATE_TASK,
            CREATE_PROJECT, UPDATE_PROJECT, CREATE_TASK, DELETE_TASK);

    private final AuthorizationGuard guard = new AuthorizationGuard();

    @ParameterizedTest
    @EnumSource(Operation.class)
    void employeeMayOnlyReadAndUpdateTasks(Operation operation) {
        assertDecision(Role.EMPLOYEE, operation, EMPLOYEE_ALLOWED.contains(operation));
    }

    @ParameterizedTest
    @EnumSource(Operation.class)
    void managerMayNotDeleteProjectsOrListUsers(Operation operation) {
        assertDecision(Role.MANAGER, operation, MANAGER_ALLOWED.contains(operation));
    }

    @ParameterizedTest
    @EnumSource(Operation.class)
    void adminMayDoEverything(Operation operation) {
        assertDecision(Role.ADMIN, operation, true);
    }

    @Test
    void missingRoleIsDenied() {
        assertThat(guard.isAllowed(null, LIST_PROJECTS)).isFalse();
    }

    @Test
    void roleHierarchyIsTotalOrder() {
        assertThat(Role.ADMIN.isAtLeast(Role.MANAGER)).isTrue();
        assertThat(Role.MANAGER.isAtLeast(Role.EMPLOYEE)).isTrue();
        assertThat(Role.EMPLOYEE.isAtLeast(Role.MANAGER)).isFalse();
        assertThat(Role.MANAGER.isAtLeast(Role.ADMIN)).isFalse();
    }

    private void assertDecision(Role role, Operation operation, boolean allowed) {
        assertThat(guard.isAllowed(role, operation)).isEqualTo(allowed);
        if (allowed) {
            assertThatCode(() -> guard.check(role, operation)).doesNotThrowAnyException();
        } else {
            assertThatThrownBy(() -> guard.check(role, operation))
                    .isInstanceOfSatisfying(CustomException.class,
                            e -> assertThat(e.getErrorCode()).isEqualTo(ErrorCode.FORBIDDEN));
        }
    }
}
