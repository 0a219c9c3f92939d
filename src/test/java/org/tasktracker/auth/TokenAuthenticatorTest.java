package org.tasktracker.auth;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.tasktracker.MutableClock;
import org.tasktracker.entity.User;
import org.tasktracker.exception.CustomException;
import org.tasktracker.exception.ErrorCode;
import org.tasktracker.utils.JwtUtils;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TokenAuthenticatorTest {

    private static final String SECRET = "dGFzay10cmFja2VyLXRlc3Qtc2lnbmluZy1rZXktMDEyMzQ1Njc4OWFiY2RlZg==";
    private static final String OTHER_SECRET = "YW5vdGhlci1zaWduaW5nLWtleS1mb3ItbmVnYXRpdmUtdGVzdHMtMDEyMzQ1Njc4OQ==";
    private static final Duration TTL = Duration.ofHours(24);

    private final Identity bob = new Identity(7L, "Bob", "bob@x.com", User.Role.EMPLOYEE);

    private MutableClock clock;
    private TokenAuthenticator authenticator;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
        authenticator = newAuthenticator(SECRET);
    }

    @Test
    void tokenCarriesIdentityClaims() {
        String token = authenticator.issue(bob);

        assertThat(token.split("\\.")).hasSize(3);
        assertThat(authenticator.resolve(token)).isEqualTo(bob);
    }

    @Test
    void resolvingNeedsNoServerState() {
        String token = authenticator.issue(bob);

        // 另一个实例只共享密钥
        assertThat(newAuthenticator(SECRET).resolve(token)).isEqualTo(bob);
    }

    @Test
    void editedRoleClaimBreaksSignature() {
        String[] parts = authenticator.issue(bob).split("\\.");
        String payload = new String(Base64.getUrlDecoder().decode(parts[1]), StandardCharsets.UTF_8);
        assertThat(payload).contains("\"role\":\"EMPLOYEE\"");

        String upgraded = payload.replace("\"role\":\"EMPLOYEE\"", "\"role\":\"ADMIN\"");
        String forged = parts[0] + "."
                + Base64.getUrlEncoder().withoutPadding().encodeToString(upgraded.getBytes(StandardCharsets.UTF_8))
                + "." + parts[2];

        assertRejected(forged, ErrorCode.INVALID_OR_EXPIRED_TOKEN);
    }

    @Test
    void tokenSignedWithAnotherSecretIsRejected() {
        String foreign = newAuthenticator(OTHER_SECRET).issue(bob);

        assertRejected(foreign, ErrorCode.INVALID_OR_EXPIRED_TOKEN);
    }

    @Test
    void tokenExpiresAtEmbeddedExpiry() {
        String token = authenticator.issue(bob);

        clock.advance(TTL.minusMinutes(1));
        assertThat(authenticator.resolve(token)).isEqualTo(bob);

        clock.advance(Duration.ofMinutes(2));
        assertRejected(token, ErrorCode.INVALID_OR_EXPIRED_TOKEN);
    }

    @Test
    void logoutDoesNotRevokeToken() {
        String token = authenticator.issue(bob);

        authenticator.invalidate(token);

        assertThat(authenticator.resolve(token)).isEqualTo(bob);
    }

    @Test
    void malformedOrMissingTokensAreUnauthenticated() {
        assertRejected(null, ErrorCode.UNAUTHENTICATED);
        assertRejected("", ErrorCode.UNAUTHENTICATED);
        assertRejected("not-a-jwt", ErrorCode.UNAUTHENTICATED);
        assertRejected("a.b.c", ErrorCode.UNAUTHENTICATED);
    }

    @Test
    void unsignedTokenIsUnauthenticated() {
        String[] parts = authenticator.issue(bob).split("\\.");
        String header = Base64.getUrlEncoder().withoutPadding()
                .encodeToString("{\"alg\":\"none\"}".getBytes(StandardCharsets.UTF_8));

        assertRejected(header + "." + parts[1] + ".", ErrorCode.UNAUTHENTICATED);
    }

    @Test
    void tokenFromAnotherIssuerIsInvalid() {
        JwtUtils otherIssuer = new JwtUtils(SECRET, "someone-else", clock);
        String token = otherIssuer.generateToken(bob, clock.instant().plus(TTL));

        assertRejected(token, ErrorCode.INVALID_OR_EXPIRED_TOKEN);
    }

    @Test
    void missingSecretFailsFast() {
        assertThatThrownBy(() -> new JwtUtils(" ", "task-tracker", clock))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void deliveredAsBearerToken() {
        assertThat(authenticator.channel()).isEqualTo(CredentialChannel.BEARER);
    }

    private TokenAuthenticator newAuthenticator(String secret) {
        return new TokenAuthenticator(new JwtUtils(secret, "task-tracker", clock), TTL, clock);
    }

    private void assertRejected(String token, ErrorCode expected) {
        assertThatThrownBy(() -> authenticator.resolve(token))
                .isInstanceOfSatisfying(CustomException.class,
                        e -> assertThat(e.getErrorCode()).isEqualTo(expected));
    }
}
