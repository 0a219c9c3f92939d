package org.tasktracker.aspect;

import org.aspectj.lang.annotation.Aspect;
import org.aspectj.lang.annotation.Before;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.annotation.Order;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;
import org.tasktracker.annotation.Guarded;
import org.tasktracker.auth.Identity;
import org.tasktracker.exception.CustomException;
import org.tasktracker.exception.ErrorCode;
import org.tasktracker.service.AuthorizationGuard;

// 先于 LogAspect 执行，被拒绝的请求不会进入业务方法
@Aspect
@Component
@Order(1)
public class GuardAspect {

    @Autowired
    private AuthorizationGuard authorizationGuard;

    @Before("@annotation(guarded)")
    public void checkRole(Guarded guarded) {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        if (authentication == null || !(authentication.getPrincipal() instanceof Identity)) {
            throw new CustomException(ErrorCode.UNAUTHENTICATED, "Authentication required");
        }
        Identity identity = (Identity) authentication.getPrincipal();
        authorizationGuard.check(identity.role(), guarded.value());
    }
}
