package org.tasktracker.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.tasktracker.repository.InMemorySessionStore;

/**
 * 定时清理进程内会话表中已过期、且之后再没有被访问过的会话。
 */
public class SessionCleanupService {

    private static final Logger logger = LoggerFactory.getLogger(SessionCleanupService.class);

    private final InMemorySessionStore sessionStore;

    public SessionCleanupService(InMemorySessionStore sessionStore) {
        this.sessionStore = sessionStore;
    }

    @Scheduled(fixedDelayString = "${tracker.auth.session.purge-interval:PT10M}",
            initialDelayString = "${tracker.auth.session.purge-interval:PT10M}")
    public void purgeExpiredSessions() {
        int removed = sessionStore.purgeExpired();
        if (removed > 0) {
            logger.info("Purged {} expired session(s), {} remaining", removed, sessionStore.size());
        } else {
            logger.debug("No expired sessions to purge");
        }
    }
}
