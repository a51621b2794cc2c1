package in.questkeeper.service.participant;

import in.questkeeper.domain.common.ErrorCode;
import in.questkeeper.domain.common.FieldError;
import in.questkeeper.domain.common.ServiceError;
import in.questkeeper.domain.common.ServiceResult;
import in.questkeeper.domain.common.ValidationResult;
import in.questkeeper.domain.encounter.CombatState;
import in.questkeeper.domain.encounter.Encounter;
import in.questkeeper.domain.encounter.Participant;
import in.questkeeper.domain.encounter.ParticipantUpdate;
import in.questkeeper.service.access.EncounterLoader;
import in.questkeeper.service.combat.CombatStateMachine;
import in.questkeeper.service.combat.InitiativeOrder;
import in.questkeeper.util.Ids;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Ordered participant collection of an encounter.
 *
 * Every operation computes the complete new list from the stored state and
 * writes it back in one replacement. Only the owner may change participants.
 */
public final class ParticipantRegistry {
    private static final Logger log = LoggerFactory.getLogger(ParticipantRegistry.class);

    public static final int MAX_PARTICIPANTS = 50;

    private final EncounterLoader loader;
    private final ParticipantValidator validator;

    public ParticipantRegistry(EncounterLoader loader, ParticipantValidator validator) {
        this.loader = loader;
        this.validator = validator;
    }

    /**
     * Append a participant at the end of the list.
     */
    public ServiceResult<Encounter> add(String encounterId, String userId, Participant participant) {
        return addBulk(encounterId, userId, List.of(participant), "");
    }

    /**
     * Append several participants. Either all are added or none.
     */
    public ServiceResult<Encounter> addBulk(String encounterId, String userId, List<Participant> participants) {
        return addBulk(encounterId, userId, participants, "participants.");
    }

    private ServiceResult<Encounter> addBulk(String encounterId, String userId, List<Participant> incoming,
                                             String pathPrefix) {
        ServiceResult<Encounter> loaded = loader.loadForOwner(encounterId, userId, "add participants to");
        if (loaded.failed()) {
            return loaded;
        }
        Encounter encounter = loaded.data();

        if (incoming == null || incoming.isEmpty()) {
            return ServiceResult.fail(ServiceError.validation("participants", "At least one participant is required"));
        }

        List<FieldError> errors = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (Participant p : encounter.participants()) {
            seen.add(p.characterId());
        }
        for (int i = 0; i < incoming.size(); i++) {
            Participant p = incoming.get(i);
            String prefix = pathPrefix.isEmpty() ? "" : pathPrefix + i + ".";
            errors.addAll(validator.validate(p, prefix).errors());
            if (p.characterId() != null && !seen.add(p.characterId())) {
                errors.add(FieldError.of(prefix + "characterId", "Participant already in encounter: " + p.characterId()));
            }
        }
        int total = encounter.participants().size() + incoming.size();
        if (total > MAX_PARTICIPANTS) {
            errors.add(FieldError.of("participants", "An encounter holds at most " + MAX_PARTICIPANTS
                + " participants, got " + total));
        }
        if (!errors.isEmpty()) {
            log.warn("Rejected {} participant(s) for encounter {}: {}", incoming.size(), encounterId, errors);
            return ServiceResult.fail(ServiceError.validation("Invalid participant data", errors));
        }

        List<Participant> next = new ArrayList<>(encounter.participants());
        next.addAll(incoming);

        ServiceResult<Encounter> saved = loader.save(encounter.withParticipants(next), ErrorCode.ENCOUNTER_SAVE_FAILED);
        saved.onSuccess(e -> log.info("Added {} participant(s) to encounter {}", incoming.size(), encounterId));
        return saved;
    }

    /**
     * Remove a participant. A matching initiative entry goes with it.
     */
    public ServiceResult<Encounter> remove(String encounterId, String userId, String participantId) {
        ServiceResult<Encounter> loaded = loader.loadForOwner(encounterId, userId, "remove participants from");
        if (loaded.failed()) {
            return loaded;
        }
        Encounter encounter = loaded.data();

        if (encounter.findParticipant(participantId) == null) {
            return ServiceResult.fail(ServiceError.participantNotFound(participantId));
        }

        List<Participant> next = new ArrayList<>(encounter.participants());
        next.removeIf(p -> p.characterId().equals(participantId));
        CombatState combat = InitiativeOrder.without(encounter.combatState(), participantId);

        ServiceResult<Encounter> saved = loader.save(encounter.withCombatAndParticipants(combat, next),
            ErrorCode.ENCOUNTER_SAVE_FAILED);
        saved.onSuccess(e -> log.info("Removed participant {} from encounter {}", participantId, encounterId));
        return saved;
    }

    /**
     * Merge allowed fields into an existing participant.
     */
    public ServiceResult<Encounter> update(String encounterId, String userId, String participantId,
                                           ParticipantUpdate update) {
        ServiceResult<Encounter> loaded = loader.loadForOwner(encounterId, userId, "update participants in");
        if (loaded.failed()) {
            return loaded;
        }
        Encounter encounter = loaded.data();

        Participant existing = encounter.findParticipant(participantId);
        if (existing == null) {
            return ServiceResult.fail(ServiceError.participantNotFound(participantId));
        }

        Participant merged = update.applyTo(existing);
        ValidationResult validation = validator.validate(merged);
        if (!validation.passed()) {
            return ServiceResult.fail(validation.toError(ErrorCode.ENCOUNTER_VALIDATION_ERROR, "Invalid participant data"));
        }

        CombatState combat = encounter.combatState();
        if (combat.phase().isRunning() && merged.initiative() != null
                && !Objects.equals(merged.initiative(), existing.initiative())) {
            int idx = combat.indexOf(participantId);
            int dex = idx >= 0 ? combat.initiativeOrder().get(idx).dexterity() : CombatStateMachine.DEFAULT_DEXTERITY;
            combat = InitiativeOrder.upsert(combat, participantId, merged.initiative(), dex);
        }
        if (combat.phase().isRunning()) {
            combat = InitiativeOrder.withActive(combat, participantId, !merged.isDown());
        }

        List<Participant> next = new ArrayList<>(encounter.participants());
        next.set(encounter.participantIndex(participantId), merged);

        return loader.save(encounter.withCombatAndParticipants(combat, next), ErrorCode.ENCOUNTER_SAVE_FAILED);
    }

    /**
     * Replace the participant order with exactly the given permutation.
     */
    public ServiceResult<Encounter> reorder(String encounterId, String userId, List<String> participantIds) {
        if (!Ids.isValid(encounterId)) {
            return ServiceResult.fail(ServiceError.validation("encounterId", "Invalid encounter id: " + encounterId));
        }
        if (participantIds == null || participantIds.isEmpty()) {
            return ServiceResult.fail(ServiceError.validation("participantIds", "Participant list must not be empty"));
        }
        List<FieldError> malformed = new ArrayList<>();
        for (int i = 0; i < participantIds.size(); i++) {
            if (!Ids.isValid(participantIds.get(i))) {
                malformed.add(FieldError.of("participantIds." + i, "Invalid participant id: " + participantIds.get(i)));
            }
        }
        if (!malformed.isEmpty()) {
            return ServiceResult.fail(ServiceError.validation("Invalid participant ids", malformed));
        }

        ServiceResult<Encounter> loaded = loader.loadForOwner(encounterId, userId, "reorder participants in");
        if (loaded.failed()) {
            return loaded;
        }
        Encounter encounter = loaded.data();

        Map<String, Participant> byId = new LinkedHashMap<>();
        for (Participant p : encounter.participants()) {
            byId.put(p.characterId(), p);
        }
        for (String id : participantIds) {
            if (!byId.containsKey(id)) {
                return ServiceResult.fail(ServiceError.participantNotFound(id));
            }
        }
        if (participantIds.size() != byId.size() || new HashSet<>(participantIds).size() != participantIds.size()) {
            return ServiceResult.fail(ServiceError.validation("participantIds",
                "Incomplete participant list: expected each of the " + byId.size() + " participants exactly once"));
        }

        List<Participant> next = new ArrayList<>(participantIds.size());
        for (String id : participantIds) {
            next.add(byId.get(id));
        }

        ServiceResult<Encounter> saved = loader.save(encounter.withParticipants(next),
            ErrorCode.PARTICIPANT_REORDER_FAILED);
        saved.onSuccess(e -> log.info("Reordered {} participants in encounter {}", next.size(), encounterId));
        return saved;
    }
}
