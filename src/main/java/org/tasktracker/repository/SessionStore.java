package org.tasktracker.repository;

import org.tasktracker.auth.Identity;

import java.time.Instant;
import java.util.Optional;

/**
 * 会话表：不透明引用 -> 身份快照，带绝对过期时间。
 * 实现必须支持并发的插入、查询和删除，过期条目在查询时惰性剔除。
 */
public interface SessionStore {

    void put(String reference, Identity identity, Instant expiresAt);

    /**
     * @return 未过期的身份；不存在或已过期时返回 empty
     */
    Optional<Identity> find(String reference);

    void remove(String reference);
}
