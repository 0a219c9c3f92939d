package org.tasktracker.aspect;

import jakarta.servlet.ServletRequest;
import jakarta.servlet.ServletResponse;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.context.request.RequestContextHolder;
import org.springframework.web.context.request.ServletRequestAttributes;
import org.tasktracker.annotation.LogAction;
import org.tasktracker.auth.Identity;
import org.tasktracker.exception.CustomException;
import org.tasktracker.utils.LogUtils;

@Aspect
@Component
@Order(2)
@Slf4j
public class LogAspect {

    // 请求/响应对象和身份快照不打印
    private static final Class<?>[] IGNORED_CLASSES = {
            ServletRequest.class, ServletResponse.class, Identity.class
    };

    @Around("@annotation(logAction)")
    public Object doAround(ProceedingJoinPoint joinPoint, LogAction logAction) throws Throwable {
        // 1. 获取基础信息
        String module = logAction.value();
        String action = logAction.action();

        // 2. 获取 Request 上下文
        ServletRequestAttributes attributes = (ServletRequestAttributes) RequestContextHolder.getRequestAttributes();
        HttpServletRequest request = attributes != null ? attributes.getRequest() : null;

        String userId = "anonymous";
        String clientIp = "0.0.0.0";
        if (request != null) {
            Object attribute = request.getAttribute("userId");
            if (attribute != null) {
                userId = String.valueOf(attribute);
            }
            clientIp = request.getRemoteAddr();
        }

        // 3. 开启性能监控
        LogUtils.PerformanceMonitor monitor = LogUtils.startPerformanceMonitor(module + "-" + action);

        // 4. 自动记录入参
        if (logAction.logArgs()) {
            LogUtils.logBusiness(module, userId, "[%s] started, ip: %s, args: %s", action, clientIp, getArgsAsText(joinPoint));
        }

        try {
            // 5. 执行业务逻辑
            Object result = joinPoint.proceed();

            // 6. 成功记录
            LogUtils.logUserOperation(userId, module, action, "SUCCESS");
            monitor.end("ok");
            return result;
        } catch (CustomException e) {
            // 7. 业务失败只记一行，由 GlobalExceptionHandler 转成响应
            LogUtils.logUserOperation(userId, module, action, "FAILED_" + e.getErrorCode());
            monitor.end("failed: " + e.getErrorCode());
            throw e;
        } catch (Throwable e) {
            LogUtils.logBusinessError(module, userId, action + " failed", e);
            monitor.end("error: " + e.getClass().getSimpleName());
            throw e;
        }
    }

    /**
     * 参数序列化：过滤请求对象等不需要记录的参数
     */
    private String getArgsAsText(ProceedingJoinPoint joinPoint) {
        Object[] args = joinPoint.getArgs();
        StringBuilder sb = new StringBuilder();
        for (Object arg : args) {
            if (arg != null && !isIgnored(arg)) {
                sb.append(arg).append(" ");
            }
        }
        return sb.toString().trim();
    }

    private boolean isIgnored(Object arg) {
        for (Class<?> clazz : IGNORED_CLASSES) {
            if (clazz.isInstance(arg)) return true;
        }
        return false;
    }
}
