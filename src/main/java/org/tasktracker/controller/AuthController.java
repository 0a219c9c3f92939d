package org.tasktracker.controller;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.tasktracker.DTO.LoginRequest;
import org.tasktracker.DTO.RegisterRequest;
import org.tasktracker.DTO.UserView;
import org.tasktracker.annotation.Guarded;
import org.tasktracker.annotation.LogAction;
import org.tasktracker.auth.Authenticator;
import org.tasktracker.auth.CredentialChannel;
import org.tasktracker.auth.CredentialTransport;
import org.tasktracker.auth.Identity;
import org.tasktracker.entity.User;
import org.tasktracker.exception.CustomException;
import org.tasktracker.exception.ErrorCode;
import org.tasktracker.service.Operation;
import org.tasktracker.service.UserService;

import java.util.LinkedHashMap;
import java.util.Map;

// 注册、登录、登出。两种认证策略共用同一套接口，只有凭证的携带方式不同
@RestController
@RequestMapping("/api")
public class AuthController {

    @Autowired
    private UserService userService;

    @Autowired
    private Authenticator authenticator;

    @Autowired
    private CredentialTransport credentialTransport;

    @PostMapping("/register")
    @LogAction(value = "AUTH", action = "REGISTER", logArgs = false)
    public ResponseEntity<Map<String, Object>> register(@RequestBody RegisterRequest request) {
        if (request == null) {
            throw new CustomException(ErrorCode.VALIDATION_ERROR, "Request body is required");
        }
        User user = userService.register(request.name(), request.email(), request.password(), request.role());
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(Map.of("message", "User registered", "user", UserView.from(user)));
    }

    // 验证用户身份并签发凭证
    @PostMapping("/login")
    @LogAction(value = "AUTH", action = "LOGIN", logArgs = false)
    public ResponseEntity<Map<String, Object>> login(@RequestBody LoginRequest request, HttpServletResponse response) {
        if (request == null || request.email() == null || request.email().isEmpty()
                || request.password() == null || request.password().isEmpty()) {
            throw new CustomException(ErrorCode.VALIDATION_ERROR, "Email and password cannot be empty");
        }
        User user = userService.verify(request.email(), request.password());
        String credential = authenticator.issue(Identity.of(user));
        long lifetimeSeconds = authenticator.lifetime().getSeconds();
        credentialTransport.attach(response, credential, lifetimeSeconds);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("message", "Login successful");
        body.put("user", UserView.from(user));
        if (authenticator.channel() == CredentialChannel.BEARER) {
            body.put("token", credential);
            body.put("tokenType", "Bearer");
            body.put("expiresIn", lifetimeSeconds);
        }
        return ResponseEntity.ok(body);
    }

    @PostMapping("/logout")
    @Guarded(Operation.LOGOUT)
    @LogAction(value = "AUTH", action = "LOGOUT", logArgs = false)
    public ResponseEntity<Map<String, Object>> logout(HttpServletRequest request, HttpServletResponse response) {
        authenticator.invalidate(credentialTransport.extract(request));
        credentialTransport.clear(response);
        return ResponseEntity.ok(Map.of("message", "Logout successful"));
    }
}
