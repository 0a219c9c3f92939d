package org.tasktracker.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.tasktracker.entity.User.Role;
import org.tasktracker.exception.CustomException;
import org.tasktracker.exception.ErrorCode;

/**
 * 按角色层级判断操作是否允许。只在认证成功之后调用。
 */
@Service
public class AuthorizationGuard {

    private static final Logger logger = LoggerFactory.getLogger(AuthorizationGuard.class);

    public boolean isAllowed(Role role, Operation operation) {
        return role != null && role.isAtLeast(operation.getMinimumRole());
    }

    /**
     * @throws CustomException FORBIDDEN，角色低于操作要求
     */
    public void check(Role role, Operation operation) {
        if (!isAllowed(role, operation)) {
            logger.warn("Denied {} for role {}", operation, role);
            throw new CustomException(ErrorCode.FORBIDDEN,
                    "Insufficient role: " + operation.getMinimumRole().value() + " or higher required");
        }
    }
}
