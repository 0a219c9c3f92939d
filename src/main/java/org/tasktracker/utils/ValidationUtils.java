package org.tasktracker.utils;

import org.tasktracker.exception.CustomException;
import org.tasktracker.exception.ErrorCode;

/**
 * 入参校验。字段长度上限与实体的列定义共用这里的常量。
 */
public class ValidationUtils {

    // 名称、邮箱、标题
    public static final int TEXT_MAX_LENGTH = 255;

    // 项目和任务的状态字符串
    public static final int STATUS_MAX_LENGTH = 64;

    private ValidationUtils() {
    }

    /**
     * 必填字段：不能为空白，且不超过长度上限
     */
    public static void requireText(String value, String field, int maxLength) {
        if (value == null || value.isBlank()) {
            throw new CustomException(ErrorCode.VALIDATION_ERROR, field + " is required");
        }
        checkLength(value, field, maxLength);
    }

    /**
     * 可选字段：为 null 时跳过
     */
    public static void checkLength(String value, String field, int maxLength) {
        if (value != null && value.length() > maxLength) {
            throw new CustomException(ErrorCode.VALIDATION_ERROR,
                    field + " must be at most " + maxLength + " characters");
        }
    }
}
