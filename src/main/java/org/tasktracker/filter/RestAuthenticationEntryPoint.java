package org.tasktracker.filter;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.security.core.AuthenticationException;
import org.springframework.security.web.AuthenticationEntryPoint;
import org.springframework.stereotype.Component;
import org.tasktracker.exception.CustomException;
import org.tasktracker.exception.ErrorCode;
import org.tasktracker.exception.GlobalExceptionHandler;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * 未认证访问受保护接口时返回 JSON 格式的 401，响应体与全局异常处理一致。
 */
@Component
public class RestAuthenticationEntryPoint implements AuthenticationEntryPoint {

    private final ObjectMapper objectMapper;

    public RestAuthenticationEntryPoint(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public void commence(HttpServletRequest request, HttpServletResponse response,
                         AuthenticationException authException) throws IOException {
        ErrorCode errorCode = ErrorCode.UNAUTHENTICATED;
        String message = "Authentication required";
        Object failure = request.getAttribute(AuthenticationFilter.AUTH_ERROR_ATTRIBUTE);
        if (failure instanceof CustomException) {
            errorCode = ((CustomException) failure).getErrorCode();
            message = ((CustomException) failure).getMessage();
        }

        response.setStatus(HttpStatus.UNAUTHORIZED.value());
        response.setCharacterEncoding(StandardCharsets.UTF_8.name());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        objectMapper.writeValue(response.getOutputStream(),
                GlobalExceptionHandler.errorBody(HttpStatus.UNAUTHORIZED, errorCode.name(), message));
    }
}
