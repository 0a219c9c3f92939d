package org.tasktracker.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.CommandLineRunner;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.tasktracker.entity.User;
import org.tasktracker.exception.CustomException;
import org.tasktracker.exception.ErrorCode;
import org.tasktracker.repository.UserRepository;
import org.tasktracker.service.UserService;

/**
 * 初始管理员账号
 * 系统没有提升角色的接口，配置了 tracker.admin.email 时在启动阶段创建管理员（已存在则跳过）
 */
@Component
@Order(1)
public class AdminInitializer implements CommandLineRunner {
    private static final Logger logger = LoggerFactory.getLogger(AdminInitializer.class);

    @Autowired
    private TrackerProperties trackerProperties;

    @Autowired
    private UserRepository userRepository;

    @Autowired
    private UserService userService;

    @Override
    public void run(String... args) {
        TrackerProperties.Admin admin = trackerProperties.getAdmin();
        if (admin.getEmail() == null || admin.getEmail().isBlank()) {
            logger.info("No bootstrap admin configured, skipping");
            return;
        }
        if (userRepository.existsByEmail(admin.getEmail())) {
            logger.info("Bootstrap admin already exists, skipping");
            return;
        }
        if (admin.getPassword() == null || admin.getPassword().isBlank()) {
            throw new IllegalStateException("tracker.admin.password must be set together with tracker.admin.email");
        }
        try {
            User created = userService.register(admin.getName(), admin.getEmail(), admin.getPassword(), User.Role.ADMIN.value());
            logger.info("Bootstrap admin created: id={}", created.getId());
        } catch (CustomException e) {
            // 多实例同时启动时，另一个实例可能已经创建
            if (e.getErrorCode() != ErrorCode.DUPLICATE_EMAIL) {
                throw e;
            }
            logger.info("Bootstrap admin created concurrently by another instance");
        }
    }
}
