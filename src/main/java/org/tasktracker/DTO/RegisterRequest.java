package org.tasktracker.DTO;

/**
 * 注册请求，role 缺省为 employee。
 */
public record RegisterRequest(String name, String email, String password, String role) {

    // 入参会被 LogAspect 打印，密码不能出现在日志里
    @Override
    public String toString() {
        return "RegisterRequest[name=" + name + ", email=" + email + ", role=" + role + "]";
    }
}
