package org.tasktracker.exception;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.util.LinkedHashMap;
import java.util.Map;

@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    /**
     * 构造统一的错误响应体，过滤器链中的 401 也复用这个格式。
     */
    public static Map<String, Object> errorBody(HttpStatusCode status, String error, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("code", status.value());
        body.put("error", error);
        body.put("message", message);
        body.put("success", false);
        return body;
    }

    @ExceptionHandler(CustomException.class)
    public ResponseEntity<Map<String, Object>> handleCustomException(CustomException ex) {
        if (ex.getErrorCode() == ErrorCode.INTERNAL) {
            logger.error("Internal failure: {}", ex.getMessage(), ex);
            return internalError();
        }
        return new ResponseEntity<>(errorBody(ex.getStatus(), ex.getErrorCode().name(), ex.getMessage()), ex.getStatus());
    }

    // 请求体无法解析、路径参数类型不对
    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class,
            MissingRequestHeaderException.class})
    public ResponseEntity<Map<String, Object>> handleBadRequest(Exception ex) {
        logger.debug("Rejected malformed request: {}", ex.getMessage());
        return ResponseEntity.badRequest()
                .body(errorBody(HttpStatus.BAD_REQUEST, ErrorCode.VALIDATION_ERROR.name(), "Malformed request"));
    }

    @ExceptionHandler({NoResourceFoundException.class, HttpRequestMethodNotSupportedException.class})
    public ResponseEntity<Map<String, Object>> handleRouting(Exception ex) {
        HttpStatusCode status = ((ErrorResponse) ex).getStatusCode();
        String error = status.value() == HttpStatus.NOT_FOUND.value() ? ErrorCode.NOT_FOUND.name() : "METHOD_NOT_ALLOWED";
        return ResponseEntity.status(status).body(errorBody(status, error, ex.getMessage()));
    }

    // 兜底：记录完整堆栈，对外只返回通用信息
    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleGeneralException(Exception ex) {
        logger.error("Unhandled exception", ex);
        return internalError();
    }

    private ResponseEntity<Map<String, Object>> internalError() {
        return ResponseEntity.internalServerError()
                .body(errorBody(HttpStatus.INTERNAL_SERVER_ERROR, ErrorCode.INTERNAL.name(), "Internal server error"));
    }
}
