package in.questkeeper.service.access;

import in.questkeeper.domain.common.ServiceError;
import in.questkeeper.domain.common.ServiceResult;
import in.questkeeper.domain.encounter.Encounter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Encounter access rules.
 *
 * Read, export and share-link generation: owner or a user on the share list.
 * Every mutation: owner only. The public flag grants neither.
 */
public final class PermissionGuard {
    private static final Logger log = LoggerFactory.getLogger(PermissionGuard.class);

    public boolean canRead(Encounter encounter, String userId) {
        return encounter.isOwnedBy(userId) || encounter.isSharedWith(userId);
    }

    public boolean canModify(Encounter encounter, String userId) {
        return encounter.isOwnedBy(userId);
    }

    public ServiceResult<Encounter> requireReadAccess(Encounter encounter, String userId, String action) {
        if (canRead(encounter, userId)) {
            return ServiceResult.ok(encounter);
        }
        log.warn("Denied {} on encounter {} for user {}", action, encounter.id(), userId);
        return ServiceResult.fail(ServiceError.permissionDenied(
            "You do not have permission to " + action + " this encounter"));
    }

    public ServiceResult<Encounter> requireOwner(Encounter encounter, String userId, String action) {
        if (canModify(encounter, userId)) {
            return ServiceResult.ok(encounter);
        }
        log.warn("Denied {} on encounter {} for non-owner {}", action, encounter.id(), userId);
        return ServiceResult.fail(ServiceError.permissionDenied(
            "Only the owner can " + action + " this encounter"));
    }
}
