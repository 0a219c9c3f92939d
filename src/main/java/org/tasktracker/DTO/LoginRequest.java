package org.tasktracker.DTO;

public record LoginRequest(String email, String password) {

    @Override
    public String toString() {
        return "LoginRequest[email=" + email + "]";
    }
}
