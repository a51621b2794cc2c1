package in.questkeeper.domain.export;

import java.time.Clock;
import java.time.Instant;

/**
 * Issued share link. Expiry is enforced by whoever resolves the link.
 */
public record ShareLink(
    String token,
    String url,
    String encounterId,
    String userId,
    Instant expiresAt
) {
    public boolean isExpired(Clock clock) {
        return !clock.instant().isBefore(expiresAt);
    }
}
