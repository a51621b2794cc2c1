package in.questkeeper.service.encounter;

import in.questkeeper.application.port.output.EncounterRepository;
import in.questkeeper.application.port.output.IdGenerator;
import in.questkeeper.application.port.output.StorageException;
import in.questkeeper.domain.common.ErrorCode;
import in.questkeeper.domain.common.ServiceError;
import in.questkeeper.domain.common.ServiceResult;
import in.questkeeper.domain.common.ValidationResult;
import in.questkeeper.domain.encounter.CombatState;
import in.questkeeper.domain.encounter.Encounter;
import in.questkeeper.domain.encounter.EncounterDifficulty;
import in.questkeeper.domain.encounter.EncounterSettings;
import in.questkeeper.domain.encounter.EncounterStatus;
import in.questkeeper.domain.encounter.Participant;
import in.questkeeper.service.access.EncounterLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Encounter lifecycle outside combat: create, read, edit, copy, share, delete.
 */
public final class EncounterService {
    private static final Logger log = LoggerFactory.getLogger(EncounterService.class);

    private final EncounterRepository encounters;
    private final EncounterLoader loader;
    private final IdGenerator ids;
    private final Clock clock;

    public EncounterService(EncounterRepository encounters, EncounterLoader loader, IdGenerator ids, Clock clock) {
        this.encounters = encounters;
        this.loader = loader;
        this.ids = ids;
        this.clock = clock;
    }

    public ServiceResult<Encounter> create(String ownerId, NewEncounter request) {
        ValidationResult check = validate(request);
        if (!check.passed()) {
            return ServiceResult.fail(ServiceError.validation("Invalid encounter", check.errors()));
        }
        Instant now = clock.instant();
        Encounter encounter = new Encounter(ids.newId(), ownerId, request.name().trim(), request.description(),
            request.tags(), request.difficulty(), request.estimatedDuration(), request.targetLevel(),
            EncounterStatus.DRAFT, request.isPublic(), List.of(), request.settings(), 1, List.of(),
            CombatState.notStarted(), now, now);

        ServiceResult<Encounter> stored = loader.insert(encounter, ErrorCode.ENCOUNTER_SAVE_FAILED);
        stored.onSuccess(e -> log.info("Created encounter {} '{}' for {}", e.id(), e.name(), ownerId));
        return stored;
    }

    public ServiceResult<Encounter> get(String encounterId, String userId) {
        return loader.loadForRead(encounterId, userId, "view");
    }

    public ServiceResult<List<Encounter>> listForOwner(String ownerId) {
        try {
            return ServiceResult.ok(encounters.findByOwner(ownerId));
        } catch (StorageException e) {
            log.error("Failed to list encounters of {}", ownerId, e);
            return ServiceResult.fail(ServiceError.storage(ErrorCode.DATABASE_ERROR, e));
        }
    }

    public ServiceResult<Encounter> updateDetails(String encounterId, String userId, NewEncounter details) {
        ValidationResult check = validate(details);
        if (!check.passed()) {
            return ServiceResult.fail(ServiceError.validation("Invalid encounter", check.errors()));
        }
        return loader.loadForOwner(encounterId, userId, "update")
            .map(e -> e.withDetails(details.name().trim(), details.description(), details.tags(),
                details.difficulty(), details.estimatedDuration(), details.targetLevel(), details.isPublic(),
                details.settings()))
            .flatMap(e -> loader.save(e, ErrorCode.ENCOUNTER_SAVE_FAILED));
    }

    public ServiceResult<Boolean> delete(String encounterId, String userId) {
        return loader.loadForOwner(encounterId, userId, "delete").flatMap(e -> {
            try {
                boolean removed = encounters.delete(encounterId);
                log.info("Deleted encounter {} for {}", encounterId, userId);
                return ServiceResult.ok(removed);
            } catch (StorageException ex) {
                log.error("Failed to delete encounter {}", encounterId, ex);
                return ServiceResult.fail(ServiceError.storage(ErrorCode.DATABASE_ERROR, ex));
            }
        });
    }

    /**
     * Copy an encounter the user can read into a new draft they own.
     *
     * @param newName optional; defaults to "<name> (Copy)"
     */
    public ServiceResult<Encounter> duplicate(String encounterId, String userId, String newName) {
        if (newName != null && (newName.isBlank() || newName.length() > 100)) {
            return ServiceResult.fail(ServiceError.validation("name", "Name must be 1 to 100 characters"));
        }
        return loader.loadForRead(encounterId, userId, "duplicate").flatMap(source -> {
            String name = newName != null ? newName.trim() : copyName(source.name());
            Instant now = clock.instant();
            Encounter copy = new Encounter(ids.newId(), userId, name, source.description(), source.tags(),
                source.difficulty(), source.estimatedDuration(), source.targetLevel(), EncounterStatus.DRAFT,
                source.isPublic(), List.of(), source.settings(), 1, source.participants(),
                CombatState.notStarted(), now, now);
            ServiceResult<Encounter> stored = loader.insert(copy, ErrorCode.ENCOUNTER_SAVE_FAILED);
            stored.onSuccess(e -> log.info("Duplicated encounter {} as {} for {}", encounterId, e.id(), userId));
            return stored;
        });
    }

    public ServiceResult<Encounter> shareWith(String encounterId, String ownerId, String targetUserId) {
        if (targetUserId == null || targetUserId.isBlank()) {
            return ServiceResult.fail(ServiceError.validation("userId", "User id is required"));
        }
        return loader.loadForOwner(encounterId, ownerId, "share").flatMap(e -> {
            if (e.isOwnedBy(targetUserId) || e.isSharedWith(targetUserId)) {
                return ServiceResult.ok(e);
            }
            List<String> shared = new ArrayList<>(e.sharedWith());
            shared.add(targetUserId);
            return loader.save(e.withSharedWith(shared), ErrorCode.ENCOUNTER_SAVE_FAILED);
        }).onSuccess(e -> log.info("Encounter {} shared with {}", encounterId, targetUserId));
    }

    public ServiceResult<Encounter> unshare(String encounterId, String ownerId, String targetUserId) {
        return loader.loadForOwner(encounterId, ownerId, "unshare").flatMap(e -> {
            if (!e.isSharedWith(targetUserId)) {
                return ServiceResult.ok(e);
            }
            List<String> shared = new ArrayList<>(e.sharedWith());
            shared.remove(targetUserId);
            return loader.save(e.withSharedWith(shared), ErrorCode.ENCOUNTER_SAVE_FAILED);
        });
    }

    /**
     * Rough difficulty from the ratio of non-player to player participants.
     */
    public static EncounterDifficulty calculateDifficulty(Encounter encounter) {
        int players = 0;
        int others = 0;
        for (Participant p : encounter.participants()) {
            if (p.isPlayer()) {
                players++;
            } else {
                others++;
            }
        }
        if (others == 0) {
            return EncounterDifficulty.TRIVIAL;
        }
        if (players == 0) {
            return EncounterDifficulty.DEADLY;
        }
        double ratio = (double) others / players;
        if (ratio <= 0.5) {
            return EncounterDifficulty.TRIVIAL;
        }
        if (ratio <= 1.0) {
            return EncounterDifficulty.EASY;
        }
        if (ratio <= 1.5) {
            return EncounterDifficulty.MEDIUM;
        }
        if (ratio <= 2.0) {
            return EncounterDifficulty.HARD;
        }
        return EncounterDifficulty.DEADLY;
    }

    static String copyName(String name) {
        String copy = name + " (Copy)";
        return copy.length() > 100 ? copy.substring(0, 100) : copy;
    }

    private static ValidationResult validate(NewEncounter request) {
        if (request == null) {
            return new ValidationResult.Builder().addError("encounter", "Required").build();
        }
        ValidationResult.Builder check = new ValidationResult.Builder()
            .requireText("name", request.name(), 1, 100)
            .maxLength("description", request.description(), 1000)
            .range("estimatedDuration", request.estimatedDuration(), 1, 480)
            .range("targetLevel", request.targetLevel(), 1, 20);

        List<String> tags = request.tags() == null ? List.of() : request.tags();
        if (tags.size() > 10) {
            check.addError("tags", "At most 10 tags");
        }
        for (int i = 0; i < tags.size(); i++) {
            check.requireText("tags." + i, tags.get(i), 1, 30);
        }

        EncounterSettings s = request.settings();
        if (s != null) {
            check.range("settings.lairActionInitiative", s.lairActionInitiative(), 1, 30)
                .range("settings.gridSize", s.gridSize(), 1, 50)
                .range("settings.roundTimeLimit", s.roundTimeLimit(), 30, 600)
                .range("settings.experienceThreshold", s.experienceThreshold(), 0, 30);
        }
        return check.build();
    }
}
