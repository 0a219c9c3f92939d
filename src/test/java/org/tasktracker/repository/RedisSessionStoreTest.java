package org.tasktracker.repository;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.ValueOperations;
import org.tasktracker.MutableClock;
import org.tasktracker.auth.Identity;
import org.tasktracker.entity.User;

import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RedisSessionStoreTest {

    private static final String KEY = "tracker:session:ref-1";

    @Mock
    private RedisTemplate<String, Object> redisTemplate;

    @Mock
    private ValueOperations<String, Object> valueOperations;

    private final MutableClock clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
    private final Identity alice = new Identity(42L, "Alice", "alice@x.com", User.Role.MANAGER);

    private RedisSessionStore store;

    @BeforeEach
    void setUp() {
        lenient().when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        store = new RedisSessionStore(redisTemplate, clock);
    }

    @Test
    @SuppressWarnings("unchecked")
    void putStoresIdentityWithRemainingLifetimeAsTtl() {
        Instant expiresAt = clock.instant().plus(Duration.ofHours(2));

        store.put("ref-1", alice, expiresAt);

        ArgumentCaptor<Object> value = ArgumentCaptor.forClass(Object.class);
        verify(valueOperations).set(eq(KEY), value.capture(), eq(Duration.ofHours(2)));
        Map<String, Object> stored = (Map<String, Object>) value.getValue();
        assertThat(stored)
                .containsEntry("userId", 42L)
                .containsEntry("name", "Alice")
                .containsEntry("email", "alice@x.com")
                .containsEntry("role", "MANAGER")
                .containsEntry("expireTime", expiresAt.toEpochMilli());
    }

    @Test
    void alreadyExpiredSessionIsNotWritten() {
        store.put("ref-1", alice, clock.instant());

        verify(valueOperations, never()).set(anyString(), any(), any(Duration.class));
    }

    @Test
    void findReadsBackIntegerAndLongNumbers() {
        Map<String, Object> entry = entry(42, clock.instant().plus(Duration.ofHours(1)).toEpochMilli());
        when(valueOperations.get(KEY)).thenReturn(entry);
        assertThat(store.find("ref-1")).contains(alice);

        entry.put("userId", 42L);
        assertThat(store.find("ref-1")).contains(alice);
    }

    @Test
    void findRechecksExpiryAgainstClock() {
        long expireTime = clock.instant().plus(Duration.ofMinutes(5)).toEpochMilli();
        when(valueOperations.get(KEY)).thenReturn(entry(42L, expireTime));

        clock.advance(Duration.ofMinutes(5));

        assertThat(store.find("ref-1")).isEmpty();
        verify(redisTemplate).delete(KEY);
    }

    @Test
    void entryWithoutExpireTimeIsDiscarded() {
        Map<String, Object> entry = entry(42L, 0L);
        entry.remove("expireTime");
        when(valueOperations.get(KEY)).thenReturn(entry);

        assertThat(store.find("ref-1")).isEmpty();
        verify(redisTemplate).delete(KEY);
    }

    @Test
    void entryWithUnknownRoleIsDiscarded() {
        Map<String, Object> entry = entry(42L, clock.instant().plus(Duration.ofHours(1)).toEpochMilli());
        entry.put("role", "ROOT");
        when(valueOperations.get(KEY)).thenReturn(entry);

        assertThat(store.find("ref-1")).isEmpty();
        verify(redisTemplate).delete(KEY);
    }

    @Test
    void missingKeyIsEmpty() {
        when(valueOperations.get(KEY)).thenReturn(null);

        assertThat(store.find("ref-1")).isEmpty();
        verify(redisTemplate, never()).delete(anyString());
    }

    @Test
    void removeDeletesPrefixedKey() {
        store.remove("ref-1");

        verify(redisTemplate).delete(KEY);
    }

    private static Map<String, Object> entry(Number userId, long expireTime) {
        Map<String, Object> entry = new HashMap<>();
        entry.put("userId", userId);
        entry.put("name", "Alice");
        entry.put("email", "alice@x.com");
        entry.put("role", "MANAGER");
        entry.put("expireTime", expireTime);
        return entry;
    }
}
