package org.tasktracker.controller;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.tasktracker.DTO.UserView;
import org.tasktracker.annotation.Guarded;
import org.tasktracker.annotation.LogAction;
import org.tasktracker.auth.Identity;
import org.tasktracker.service.Operation;
import org.tasktracker.service.UserService;

import java.util.List;

@RestController
@RequestMapping("/api/users")
public class UserController {

    @Autowired
    private UserService userService;

    // 获取当前用户信息
    @GetMapping("/profile")
    @Guarded(Operation.READ_OWN_PROFILE)
    @LogAction(value = "USER", action = "PROFILE")
    public ResponseEntity<UserView> profile(@AuthenticationPrincipal Identity identity) {
        return ResponseEntity.ok(UserView.from(userService.getById(identity.id())));
    }

    // 管理员查看全部用户
    @GetMapping
    @Guarded(Operation.LIST_USERS)
    @LogAction(value = "USER", action = "LIST")
    public ResponseEntity<List<UserView>> listUsers() {
        return ResponseEntity.ok(userService.listUsers().stream().map(UserView::from).toList());
    }
}
