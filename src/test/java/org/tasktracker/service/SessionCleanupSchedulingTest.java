package org.tasktracker.service;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.scheduling.config.ScheduledTaskHolder;
import org.springframework.test.context.ActiveProfiles;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@ActiveProfiles("test")
class SessionCleanupSchedulingTest {

    @Autowired
    private ScheduledTaskHolder scheduledTaskHolder;

    @Autowired
    private SessionCleanupService sessionCleanupService;

    @Test
    void purgeIsRegisteredAsScheduledTask() {
        assertThat(sessionCleanupService).isNotNull();
        assertThat(scheduledTaskHolder.getScheduledTasks())
                .anySatisfy(task -> assertThat(task.getTask().getRunnable().toString())
                        .contains("SessionCleanupService.purgeExpiredSessions"));
    }
}
