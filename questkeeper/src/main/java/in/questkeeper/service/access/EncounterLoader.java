package in.questkeeper.service.access;

import in.questkeeper.application.port.output.EncounterRepository;
import in.questkeeper.application.port.output.StorageException;
import in.questkeeper.domain.common.ErrorCode;
import in.questkeeper.domain.common.ServiceError;
import in.questkeeper.domain.common.ServiceResult;
import in.questkeeper.domain.encounter.Encounter;
import in.questkeeper.util.Ids;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Load-check-save steps every encounter operation starts and ends with.
 * Storage failures come back as STORAGE errors, never as exceptions.
 */
public final class EncounterLoader {
    private static final Logger log = LoggerFactory.getLogger(EncounterLoader.class);

    private final EncounterRepository encounters;
    private final PermissionGuard guard;

    public EncounterLoader(EncounterRepository encounters, PermissionGuard guard) {
        this.encounters = encounters;
        this.guard = guard;
    }

    public ServiceResult<Encounter> load(String encounterId) {
        if (!Ids.isValid(encounterId)) {
            return ServiceResult.fail(ServiceError.validation("encounterId", "Invalid encounter id: " + encounterId));
        }
        try {
            Optional<Encounter> found = encounters.findById(encounterId);
            if (found.isEmpty()) {
                return ServiceResult.fail(ServiceError.encounterNotFound(encounterId));
            }
            return ServiceResult.ok(found.get());
        } catch (StorageException e) {
            log.error("Failed to load encounter {}", encounterId, e);
            return ServiceResult.fail(ServiceError.storage(ErrorCode.DATABASE_ERROR, e));
        }
    }

    public ServiceResult<Encounter> loadForRead(String encounterId, String userId, String action) {
        return load(encounterId).flatMap(e -> guard.requireReadAccess(e, userId, action));
    }

    public ServiceResult<Encounter> loadForOwner(String encounterId, String userId, String action) {
        return load(encounterId).flatMap(e -> guard.requireOwner(e, userId, action));
    }

    /**
     * Persist a fully computed replacement in one write.
     *
     * @param failureCode code reported if the store rejects the write
     */
    public ServiceResult<Encounter> save(Encounter updated, ErrorCode failureCode) {
        try {
            return ServiceResult.ok(encounters.update(updated));
        } catch (StorageException e) {
            if (e.isConflict()) {
                log.warn("Concurrent modification of encounter {}: {}", updated.id(), e.getMessage());
            } else {
                log.error("Failed to save encounter {}", updated.id(), e);
            }
            return ServiceResult.fail(ServiceError.storage(failureCode, e));
        }
    }

    public ServiceResult<Encounter> insert(Encounter created, ErrorCode failureCode) {
        try {
            return ServiceResult.ok(encounters.insert(created));
        } catch (StorageException e) {
            log.error("Failed to insert encounter {}", created.id(), e);
            return ServiceResult.fail(ServiceError.storage(failureCode, e));
        }
    }
}
