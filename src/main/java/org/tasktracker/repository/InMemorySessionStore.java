package org.tasktracker.repository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tasktracker.auth.Identity;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * 进程内会话表，单实例部署时使用。
 */
public class InMemorySessionStore implements SessionStore {

    private static final Logger logger = LoggerFactory.getLogger(InMemorySessionStore.class);

    private final ConcurrentMap<String, Entry> sessions = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemorySessionStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public void put(String reference, Identity identity, Instant expiresAt) {
        sessions.put(reference, new Entry(identity, expiresAt));
    }

    @Override
    public Optional<Identity> find(String reference) {
        Entry entry = sessions.get(reference);
        if (entry == null) {
            return Optional.empty();
        }
        if (!clock.instant().isBefore(entry.expiresAt())) {
            // 只删除读到的这一条，避免误删同一引用上并发写入的新值
            sessions.remove(reference, entry);
            logger.debug("Evicted expired session for user: {}", entry.identity().id());
            return Optional.empty();
        }
        return Optional.of(entry.identity());
    }

    @Override
    public void remove(String reference) {
        sessions.remove(reference);
    }

    /**
     * 清理所有已过期的会话，由 SessionCleanupService 定时调用。
     *
     * @return 清理掉的条目数
     */
    public int purgeExpired() {
        Instant now = clock.instant();
        int before = sessions.size();
        sessions.values().removeIf(entry -> !now.isBefore(entry.expiresAt()));
        return before - sessions.size();
    }

    public int size() {
        return sessions.size();
    }

    private record Entry(Identity identity, Instant expiresAt) {
    }
}
