package in.questkeeper.service.export;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import in.questkeeper.domain.common.ServiceError;
import in.questkeeper.domain.common.ServiceResult;
import in.questkeeper.domain.encounter.Encounter;
import in.questkeeper.domain.export.ShareLink;
import in.questkeeper.service.access.EncounterLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.security.GeneralSecurityException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;
import java.util.Random;

/**
 * Opaque share tokens for encounters.
 *
 * Token: base64url(HMAC-SHA256 signature) followed by base64url(payload), cut
 * to {@link #TOKEN_LENGTH} characters. Each token is signed with its own random
 * key, so tokens are unguessable but not verifiable later; expiry is enforced by
 * whoever stores and resolves the link.
 */
public final class ShareLinkService {
    private static final Logger log = LoggerFactory.getLogger(ShareLinkService.class);

    public static final int TOKEN_LENGTH = 64;
    public static final Duration DEFAULT_TTL = Duration.ofHours(24);
    private static final int KEY_BYTES = 32;

    private final EncounterLoader loader;
    private final ObjectMapper mapper;
    private final Random keySource;
    private final Clock clock;
    private final String publicBaseUrl;

    public ShareLinkService(EncounterLoader loader, ObjectMapper mapper, Random keySource, Clock clock,
                            String publicBaseUrl) {
        this.loader = loader;
        this.mapper = mapper;
        this.keySource = keySource;
        this.clock = clock;
        this.publicBaseUrl = publicBaseUrl.endsWith("/")
            ? publicBaseUrl.substring(0, publicBaseUrl.length() - 1) : publicBaseUrl;
    }

    public ServiceResult<ShareLink> generate(String encounterId, String userId, Duration ttl) {
        if (ttl == null || ttl.isNegative() || ttl.isZero()) {
            return ServiceResult.fail(ServiceError.validation("expiresIn", "Expiry must be positive"));
        }
        ServiceResult<Encounter> loaded = loader.loadForRead(encounterId, userId, "share");
        if (loaded.failed()) {
            return loaded.propagate();
        }

        Instant expiresAt = clock.instant().plus(ttl);
        String token = token(encounterId, userId, expiresAt);
        ShareLink link = new ShareLink(token, publicBaseUrl + "/encounters/shared/" + token,
            encounterId, userId, expiresAt);

        log.info("Issued share link for encounter {} by {} (expires {})", encounterId, userId, expiresAt);
        return ServiceResult.ok(link);
    }

    private String token(String encounterId, String userId, Instant expiresAt) {
        ObjectNode payload = mapper.createObjectNode()
            .put("encounterId", encounterId)
            .put("userId", userId)
            .put("expiresAt", expiresAt.toEpochMilli());

        byte[] key = new byte[KEY_BYTES];
        keySource.nextBytes(key);

        try {
            byte[] body = mapper.writeValueAsBytes(payload);
            Mac mac = Mac.getInstance("HmacSHA256");
            mac.init(new SecretKeySpec(key, "HmacSHA256"));
            byte[] signature = mac.doFinal(body);

            Base64.Encoder b64 = Base64.getUrlEncoder().withoutPadding();
            String joined = b64.encodeToString(signature) + b64.encodeToString(body);
            return joined.substring(0, Math.min(TOKEN_LENGTH, joined.length()));
        } catch (GeneralSecurityException | JsonProcessingException e) {
            throw new IllegalStateException("Failed to sign share token", e);
        }
    }
}
