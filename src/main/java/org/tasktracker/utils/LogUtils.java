package org.tasktracker.utils;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * 日志工具类
 * 提供统一的日志记录方法和格式
 */
public class LogUtils {

    // 业务日志记录器
    private static final Logger BUSINESS_LOGGER = LoggerFactory.getLogger("org.tasktracker.business");

    // 性能日志记录器
    private static final Logger PERFORMANCE_LOGGER = LoggerFactory.getLogger("org.tasktracker.performance");

    // MDC键名常量
    public static final String USER_ID = "userId";
    public static final String REQUEST_ID = "requestId";
    public static final String OPERATION = "operation";

    private LogUtils() {
    }

    /**
     * 记录业务日志
     */
    public static void logBusiness(String operation, String userId, String message, Object... args) {
        try {
            MDC.put(OPERATION, operation);
            BUSINESS_LOGGER.info("[{}] [user:{}] {}", operation, userId, formatMessage(message, args));
        } finally {
            MDC.remove(OPERATION);
        }
    }

    /**
     * 记录业务错误日志
     */
    public static void logBusinessError(String operation, String userId, String message, Throwable throwable, Object... args) {
        try {
            MDC.put(OPERATION, operation);
            BUSINESS_LOGGER.error("[{}] [user:{}] {}", operation, userId, formatMessage(message, args), throwable);
        } finally {
            MDC.remove(OPERATION);
        }
    }

    /**
     * 记录性能日志
     */
    public static void logPerformance(String operation, long duration, String details) {
        try {
            MDC.put(OPERATION, operation);
            PERFORMANCE_LOGGER.info("[perf] [{}] {}ms {}", operation, duration, details);
        } finally {
            MDC.remove(OPERATION);
        }
    }

    /**
     * 记录用户操作日志
     */
    public static void logUserOperation(String userId, String operation, String resource, String result) {
        try {
            MDC.put(OPERATION, operation);
            BUSINESS_LOGGER.info("[op] [user:{}] [operation:{}] [resource:{}] [result:{}]", userId, operation, resource, result);
        } finally {
            MDC.remove(OPERATION);
        }
    }

    /**
     * 设置请求上下文
     */
    public static void setRequestContext(String requestId, String userId) {
        MDC.put(REQUEST_ID, requestId);
        if (userId != null) {
            MDC.put(USER_ID, userId);
        }
    }

    /**
     * 清除请求上下文
     */
    public static void clearRequestContext() {
        MDC.clear();
    }

    /**
     * 格式化消息
     */
    private static String formatMessage(String message, Object... args) {
        if (args == null || args.length == 0) {
            return message;
        }
        try {
            return String.format(message, args);
        } catch (Exception e) {
            return message + " [format failed: " + e.getMessage() + "]";
        }
    }

    /**
     * 性能监控装饰器
     */
    public static class PerformanceMonitor {
        private final String operation;
        private final long startTime;

        public PerformanceMonitor(String operation) {
            this.operation = operation;
            this.startTime = System.currentTimeMillis();
        }

        public void end(String details) {
            long duration = System.currentTimeMillis() - startTime;
            logPerformance(operation, duration, details);
        }
    }

    /**
     * 创建性能监控器
     */
    public static PerformanceMonitor startPerformanceMonitor(String operation) {
        return new PerformanceMonitor(operation);
    }
}
