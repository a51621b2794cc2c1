package in.questkeeper.domain.encounter;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Encounter aggregate. Immutable; every change produces a new value that
 * the repository stores as a single replacement.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Encounter(
    String id,
    String ownerId,
    String name,
    String description,
    List<String> tags,
    EncounterDifficulty difficulty,
    Integer estimatedDuration,        // minutes
    Integer targetLevel,
    EncounterStatus status,
    @JsonProperty("isPublic") boolean isPublic,
    List<String> sharedWith,          // user ids with read/export access
    EncounterSettings settings,
    int version,                      // optimistic concurrency
    List<Participant> participants,
    CombatState combatState,
    Instant createdAt,
    Instant updatedAt
) {
    public Encounter {
        description = description == null ? "" : description;
        tags = tags == null ? List.of() : List.copyOf(new LinkedHashSet<>(tags));
        status = status == null ? EncounterStatus.DRAFT : status;
        sharedWith = sharedWith == null ? List.of() : List.copyOf(new LinkedHashSet<>(sharedWith));
        settings = settings == null ? EncounterSettings.defaults() : settings;
        participants = participants == null ? List.of() : List.copyOf(participants);
        combatState = combatState == null ? CombatState.notStarted() : combatState;
    }

    public Participant findParticipant(String participantId) {
        for (Participant p : participants) {
            if (p.characterId().equals(participantId)) {
                return p;
            }
        }
        return null;
    }

    public int participantIndex(String participantId) {
        for (int i = 0; i < participants.size(); i++) {
            if (participants.get(i).characterId().equals(participantId)) {
                return i;
            }
        }
        return -1;
    }

    public boolean isOwnedBy(String userId) {
        return ownerId != null && ownerId.equals(userId);
    }

    public boolean isSharedWith(String userId) {
        return userId != null && sharedWith.contains(userId);
    }

    public Encounter withParticipants(List<Participant> value) {
        return new Encounter(id, ownerId, name, description, tags, difficulty, estimatedDuration, targetLevel,
            status, isPublic, sharedWith, settings, version, value, combatState, createdAt, updatedAt);
    }

    public Encounter withParticipant(Participant replacement) {
        List<Participant> next = new ArrayList<>(participants);
        int idx = participantIndex(replacement.characterId());
        if (idx < 0) {
            throw new IllegalArgumentException("Unknown participant: " + replacement.characterId());
        }
        next.set(idx, replacement);
        return withParticipants(next);
    }

    public Encounter withCombat(CombatState value, EncounterStatus newStatus) {
        return new Encounter(id, ownerId, name, description, tags, difficulty, estimatedDuration, targetLevel,
            newStatus, isPublic, sharedWith, settings, version, participants, value, createdAt, updatedAt);
    }

    public Encounter withCombatAndParticipants(CombatState value, List<Participant> newParticipants) {
        return new Encounter(id, ownerId, name, description, tags, difficulty, estimatedDuration, targetLevel,
            status, isPublic, sharedWith, settings, version, newParticipants, value, createdAt, updatedAt);
    }

    public Encounter withSharedWith(List<String> value) {
        return new Encounter(id, ownerId, name, description, tags, difficulty, estimatedDuration, targetLevel,
            status, isPublic, value, settings, version, participants, combatState, createdAt, updatedAt);
    }

    public Encounter withDetails(String newName, String newDescription, List<String> newTags,
                                 EncounterDifficulty newDifficulty, Integer newDuration, Integer newTargetLevel,
                                 boolean newIsPublic, EncounterSettings newSettings) {
        return new Encounter(id, ownerId, newName, newDescription, newTags, newDifficulty, newDuration,
            newTargetLevel, status, newIsPublic, sharedWith, newSettings, version, participants, combatState,
            createdAt, updatedAt);
    }

    public Encounter withIdentity(String newId, String newOwnerId, int newVersion, Instant created, Instant updated) {
        return new Encounter(newId, newOwnerId, name, description, tags, difficulty, estimatedDuration, targetLevel,
            status, isPublic, sharedWith, settings, newVersion, participants, combatState, created, updated);
    }

    public Encounter withStored(int newVersion, Instant updated) {
        return new Encounter(id, ownerId, name, description, tags, difficulty, estimatedDuration, targetLevel,
            status, isPublic, sharedWith, settings, newVersion, participants, combatState, createdAt, updated);
    }
}
