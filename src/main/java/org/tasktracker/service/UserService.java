package org.tasktracker.service;

import org.tasktracker.entity.User;
import org.tasktracker.exception.CustomException;
import org.tasktracker.exception.ErrorCode;
import org.tasktracker.repository.UserRepository;
import org.tasktracker.utils.PasswordUtils;
import org.tasktracker.utils.SqlErrorUtils;
import org.tasktracker.utils.ValidationUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * 用户凭证存储：注册与密码校验。
 */
@Service
public class UserService {

    private static final Logger logger = LoggerFactory.getLogger(UserService.class);

    @Autowired
    private UserRepository userRepository;

    /**
     * 注册新用户。
     * 邮箱唯一性由数据库唯一约束保证，并发注册同一邮箱时只有一个能成功。
     *
     * @param name     用户名称
     * @param email    邮箱，按原样存储
     * @param password 明文密码，只保存 BCrypt 哈希
     * @param role     角色字符串，null 表示 employee
     * @return 新建的用户
     * @throws CustomException DUPLICATE_EMAIL 邮箱已被使用；VALIDATION_ERROR 参数缺失或角色非法
     */
    public User register(String name, String email, String password, String role) {
        ValidationUtils.requireText(name, "name", ValidationUtils.TEXT_MAX_LENGTH);
        ValidationUtils.requireText(email, "email", ValidationUtils.TEXT_MAX_LENGTH);
        if (password == null || password.isBlank()) {
            throw new CustomException(ErrorCode.VALIDATION_ERROR, "password is required");
        }
        User.Role parsedRole = User.Role.parse(role);

        User user = new User();
        user.setName(name.trim());
        user.setEmail(email);
        user.setPassword(PasswordUtils.encode(password));
        user.setRole(parsedRole != null ? parsedRole : User.Role.EMPLOYEE);

        try {
            User saved = userRepository.saveAndFlush(user);
            logger.info("User registered: id={}, role={}", saved.getId(), saved.getRole());
            return saved;
        } catch (DataIntegrityViolationException e) {
            if (!SqlErrorUtils.isUniqueViolation(e)) {
                throw e;
            }
            logger.info("Registration rejected, email already in use");
            throw new CustomException(ErrorCode.DUPLICATE_EMAIL, "User with this email already exists");
        }
    }

    /**
     * 校验邮箱和密码。用户不存在与密码错误返回同一个错误。
     *
     * @throws CustomException INVALID_CREDENTIALS
     */
    @Transactional(readOnly = true)
    public User verify(String email, String password) {
        User user = email == null ? null : userRepository.findByEmail(email).orElse(null);
        boolean valid = user != null
                ? PasswordUtils.matches(password, user.getPassword())
                : PasswordUtils.matchesUnknownUser(password);
        if (!valid) {
            throw new CustomException(ErrorCode.INVALID_CREDENTIALS, "Invalid email or password");
        }
        return user;
    }

    @Transactional(readOnly = true)
    public User getById(Long id) {
        return userRepository.findById(id)
                .orElseThrow(() -> new CustomException(ErrorCode.NOT_FOUND, "User not found"));
    }

    @Transactional(readOnly = true)
    public List<User> listUsers() {
        return userRepository.findAllByOrderByIdAsc();
    }
}
