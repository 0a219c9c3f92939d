package org.tasktracker.auth;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.tasktracker.MutableClock;
import org.tasktracker.entity.User;
import org.tasktracker.exception.CustomException;
import org.tasktracker.exception.ErrorCode;
import org.tasktracker.repository.InMemorySessionStore;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SessionAuthenticatorTest {

    private static final Duration TTL = Duration.ofHours(24);

    private final Identity alice = new Identity(1L, "Alice", "alice@x.com", User.Role.MANAGER);

    private MutableClock clock;
    private InMemorySessionStore store;
    private SessionAuthenticator authenticator;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
        store = new InMemorySessionStore(clock);
        authenticator = new SessionAuthenticator(store, TTL, clock);
    }

    @Test
    void issuedReferenceResolvesToSameIdentity() {
        String reference = authenticator.issue(alice);

        assertThat(reference).isNotBlank().doesNotContain("alice");
        assertThat(authenticator.resolve(reference)).isEqualTo(alice);
    }

    @Test
    void everyLoginGetsItsOwnReference() {
        assertThat(authenticator.issue(alice)).isNotEqualTo(authenticator.issue(alice));
        assertThat(store.size()).isEqualTo(2);
    }

    @Test
    void missingOrUnknownReferenceIsUnauthenticated() {
        assertUnauthenticated(null);
        assertUnauthenticated("  ");
        assertUnauthenticated("no-such-session");
    }

    @Test
    void invalidateEndsSessionBeforeExpiry() {
        String reference = authenticator.issue(alice);

        authenticator.invalidate(reference);

        assertUnauthenticated(reference);
        assertThat(store.size()).isZero();
    }

    @Test
    void sessionExpiresAfterAbsoluteLifetime() {
        String reference = authenticator.issue(alice);

        clock.advance(TTL.minusMinutes(1));
        assertThat(authenticator.resolve(reference)).isEqualTo(alice);

        clock.advance(Duration.ofMinutes(1));
        assertUnauthenticated(reference);
        assertThat(store.size()).isZero();
    }

    @Test
    void deliveredThroughCookie() {
        assertThat(authenticator.channel()).isEqualTo(CredentialChannel.COOKIE);
        assertThat(authenticator.lifetime()).isEqualTo(TTL);
    }

    private void assertUnauthenticated(String reference) {
        assertThatThrownBy(() -> authenticator.resolve(reference))
                .isInstanceOfSatisfying(CustomException.class,
                        e -> assertThat(e.getErrorCode()).isEqualTo(ErrorCode.UNAUTHENTICATED));
    }
}
