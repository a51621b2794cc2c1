package in.questkeeper.auth;

import com.fasterxml.jackson.databind.ObjectMapper;
import in.questkeeper.support.TestClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("JWT Service")
class JwtServiceTest {

    private static final String SECRET = "0123456789abcdef0123456789abcdef";

    private TestClock clock;
    private JwtService jwt;

    @BeforeEach
    void setUp() {
        clock = new TestClock();
        jwt = new JwtService(SECRET, new ObjectMapper(), clock);
    }

    @Test
    @DisplayName("Issued tokens validate and carry their claims")
    void testRoundTrip() {
        String token = jwt.generateToken("owner-1", "gm@example.com", Duration.ofHours(1));

        assertEquals("owner-1", jwt.validateAndGetUserId(token));
        JwtService.TokenClaims claims = jwt.getClaims("Bearer " + token);
        assertEquals("gm@example.com", claims.email());
        assertEquals(clock.millis(), claims.issuedAt());
        assertEquals(clock.millis() + 3_600_000L, claims.expiresAt());
    }

    @Test
    @DisplayName("Expired tokens are rejected")
    void testExpired() {
        String token = jwt.generateToken("owner-1", null, Duration.ofMinutes(10));
        clock.advance(Duration.ofMinutes(11));

        assertNull(jwt.validateAndGetUserId(token));
    }

    @Test
    @DisplayName("Tokens signed with another secret or tampered with are rejected")
    void testSignature() {
        JwtService other = new JwtService("another-secret-another-secret-xx", new ObjectMapper(), clock);
        String foreign = other.generateToken("owner-1", null, Duration.ofHours(1));
        assertNull(jwt.validateAndGetUserId(foreign));

        String token = jwt.generateToken("owner-1", null, Duration.ofHours(1));
        String[] parts = token.split("\\.");
        String forged = parts[0] + "." + other.generateToken("admin", null, Duration.ofHours(1)).split("\\.")[1]
            + "." + parts[2];
        assertNull(jwt.validateAndGetUserId(forged));
    }

    @Test
    @DisplayName("Garbage input yields null rather than an exception")
    void testGarbage() {
        assertNull(jwt.getClaims(null));
        assertNull(jwt.getClaims(""));
        assertNull(jwt.getClaims("Bearer abc"));
        assertNull(jwt.getClaims("a.b.c"));
    }
}
