package org.tasktracker.controller;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.env.Environment;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
public class HealthController {

    @Autowired
    private Environment environment;

    // 无需认证
    @GetMapping("/api/health")
    public Map<String, Object> health() {
        String[] profiles = environment.getActiveProfiles();
        String env = profiles.length > 0 ? String.join(",", profiles) : "development";
        return Map.of("status", "API running", "env", env);
    }
}
