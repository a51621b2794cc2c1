package in.questkeeper.auth;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.time.Clock;
import java.time.Duration;
import java.util.Base64;

/**
 * HS256 bearer token validation.
 *
 * Tokens are issued by the external auth system; {@link #generateToken} exists
 * for local tooling and tests.
 */
public final class JwtService {
    private static final Logger log = LoggerFactory.getLogger(JwtService.class);

    private static final String HEADER = "{\"alg\":\"HS256\",\"typ\":\"JWT\"}";

    private final byte[] secret;
    private final ObjectMapper mapper;
    private final Clock clock;

    public JwtService(String secret, ObjectMapper mapper, Clock clock) {
        this.secret = secret.getBytes(StandardCharsets.UTF_8);
        this.mapper = mapper;
        this.clock = clock;
    }

    /**
     * Issue a token for a user.
     */
    public String generateToken(String userId, String email, Duration ttl) {
        long now = clock.millis() / 1000;
        ObjectNode claims = mapper.createObjectNode()
            .put("sub", userId)
            .put("email", email)
            .put("iat", now)
            .put("exp", now + ttl.getSeconds());

        String header = base64Encode(HEADER.getBytes(StandardCharsets.UTF_8));
        String payload;
        try {
            payload = base64Encode(mapper.writeValueAsBytes(claims));
        } catch (IOException e) {
            throw new IllegalStateException("Failed to encode JWT claims", e);
        }
        return header + "." + payload + "." + sign(header + "." + payload);
    }

    /**
     * Validate token and extract user ID.
     * Returns null if invalid.
     */
    public String validateAndGetUserId(String token) {
        TokenClaims claims = getClaims(token);
        return claims == null ? null : claims.userId();
    }

    /**
     * Verified, unexpired claims, or null.
     */
    public TokenClaims getClaims(String token) {
        if (token == null || token.isEmpty()) {
            return null;
        }
        if (token.startsWith("Bearer ")) {
            token = token.substring(7);
        }

        String[] parts = token.split("\\.");
        if (parts.length != 3) {
            log.debug("Invalid token format");
            return null;
        }

        byte[] expected = sign(parts[0] + "." + parts[1]).getBytes(StandardCharsets.US_ASCII);
        if (!MessageDigest.isEqual(expected, parts[2].getBytes(StandardCharsets.US_ASCII))) {
            log.debug("Invalid token signature");
            return null;
        }

        JsonNode payload;
        try {
            payload = mapper.readTree(Base64.getUrlDecoder().decode(parts[1]));
        } catch (IOException | IllegalArgumentException e) {
            log.debug("Token payload unreadable: {}", e.getMessage());
            return null;
        }

        String sub = payload.path("sub").asText(null);
        if (sub == null || !payload.path("exp").canConvertToLong()) {
            log.debug("Missing required claims");
            return null;
        }

        TokenClaims claims = new TokenClaims(sub, payload.path("email").asText(null),
            payload.path("iat").asLong() * 1000, payload.path("exp").asLong() * 1000);
        if (clock.millis() > claims.expiresAt()) {
            log.debug("Token expired");
            return null;
        }
        return claims;
    }

    private String sign(String data) {
        try {
            Mac mac = Mac.getInstance("HmacSHA256");
            mac.init(new SecretKeySpec(secret, "HmacSHA256"));
            return base64Encode(mac.doFinal(data.getBytes(StandardCharsets.UTF_8)));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Failed to sign JWT", e);
        }
    }

    private static String base64Encode(byte[] data) {
        return Base64.getUrlEncoder().withoutPadding().encodeToString(data);
    }

    public record TokenClaims(
        String userId,
        String email,
        long issuedAt,
        long expiresAt
    ) {
    }
}
