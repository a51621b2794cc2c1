package in.questkeeper.service.transfer;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import in.questkeeper.application.port.output.CharacterRepository;
import in.questkeeper.application.port.output.IdGenerator;
import in.questkeeper.application.port.output.StorageException;
import in.questkeeper.domain.character.CharacterSheet;
import in.questkeeper.domain.common.ErrorCode;
import in.questkeeper.domain.common.FieldError;
import in.questkeeper.domain.common.ServiceError;
import in.questkeeper.domain.common.ServiceResult;
import in.questkeeper.domain.encounter.CombatState;
import in.questkeeper.domain.encounter.Encounter;
import in.questkeeper.domain.encounter.EncounterStatus;
import in.questkeeper.domain.encounter.Participant;
import in.questkeeper.domain.export.CharacterSheetPayload;
import in.questkeeper.domain.export.EncounterPayload;
import in.questkeeper.domain.export.ExportEnvelope;
import in.questkeeper.domain.export.ImportOptions;
import in.questkeeper.domain.export.ParticipantPayload;
import in.questkeeper.service.access.EncounterLoader;
import in.questkeeper.service.schema.EnvelopeSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Rebuilds a new encounter from a parsed envelope tree.
 *
 * Import never touches an existing encounter: the result always has a fresh id,
 * version 1, draft status and no combat in progress.
 */
public final class ImportProcessor {
    private static final Logger log = LoggerFactory.getLogger(ImportProcessor.class);

    private final EnvelopeSchema schema;
    private final ObjectMapper mapper;
    private final EncounterLoader loader;
    private final CharacterRepository characters;
    private final IdGenerator ids;
    private final Clock clock;

    public ImportProcessor(EnvelopeSchema schema, ObjectMapper mapper, EncounterLoader loader,
                           CharacterRepository characters, IdGenerator ids, Clock clock) {
        this.schema = schema;
        this.mapper = mapper;
        this.loader = loader;
        this.characters = characters;
        this.ids = ids;
        this.clock = clock;
    }

    public ServiceResult<Encounter> importEnvelope(JsonNode rawEnvelope, ImportOptions options) {
        if (options == null || options.ownerId() == null || options.ownerId().isBlank()) {
            return ServiceResult.fail(ServiceError.validation("ownerId", "Owner is required for import"));
        }

        List<FieldError> errors = schema.validate(rawEnvelope);
        if (!errors.isEmpty()) {
            log.warn("Import for {} rejected: {} schema violation(s), first: {}",
                options.ownerId(), errors.size(), errors.get(0));
            return ServiceResult.fail(ServiceError.of(ErrorCode.INVALID_IMPORT_FORMAT,
                "Invalid import format: " + errors.size() + " field error(s)", errors));
        }

        ExportEnvelope envelope;
        try {
            envelope = mapper.treeToValue(rawEnvelope, ExportEnvelope.class);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.warn("Import for {} rejected: envelope does not bind: {}", options.ownerId(), e.getMessage());
            return ServiceResult.fail(ServiceError.of(ErrorCode.INVALID_IMPORT_FORMAT,
                "Invalid import format: " + e.getMessage()));
        }

        return importEnvelope(envelope, options);
    }

    /**
     * Import an already bound envelope. Callers are expected to have validated it.
     */
    ServiceResult<Encounter> importEnvelope(ExportEnvelope envelope, ImportOptions options) {
        EncounterPayload source = envelope.encounter();
        Instant now = clock.instant();

        List<String> inserted = new ArrayList<>();
        Map<String, String> createdCharacters;
        try {
            createdCharacters = createCharacters(source, options, now, inserted);
        } catch (StorageException e) {
            log.error("Failed to create characters during import for {}", options.ownerId(), e);
            rollBack(inserted);
            return ServiceResult.fail(ServiceError.storage(ErrorCode.ENCOUNTER_IMPORT_FAILED, e));
        }

        List<Participant> participants = new ArrayList<>(source.participants().size());
        Set<String> used = new HashSet<>();
        for (ParticipantPayload p : source.participants()) {
            String characterId = createdCharacters.get(p.id());
            if (characterId == null || !used.add(characterId)) {
                characterId = ids.newId();
                used.add(characterId);
            }
            participants.add(new Participant(characterId, p.name(), p.type(),
                p.maxHitPoints(), p.currentHitPoints(), p.temporaryHitPoints(), p.armorClass(),
                p.initiative(), p.isPlayer(), p.isVisible(), p.notes(), p.conditions(), p.position()));
        }

        Encounter encounter = new Encounter(
            ids.newId(), options.ownerId(), source.name(), source.description(), source.tags(),
            source.difficulty(), source.estimatedDuration(), source.targetLevel(), EncounterStatus.DRAFT,
            source.isPublic(), List.of(), source.settings(), 1, participants, CombatState.notStarted(),
            now, now);

        ServiceResult<Encounter> stored = loader.insert(encounter, ErrorCode.ENCOUNTER_IMPORT_FAILED);
        if (stored.failed()) {
            rollBack(inserted);
            return stored;
        }
        log.info("✓ Imported encounter {} ({}) for {}: {} participants, {} characters created",
            encounter.id(), encounter.name(), encounter.ownerId(), encounter.participants().size(), inserted.size());
        return stored;
    }

    /**
     * Remove characters created by a failed import. A character that cannot be
     * removed is logged and left behind; the import still reports its original failure.
     */
    private void rollBack(List<String> inserted) {
        for (String characterId : inserted) {
            try {
                characters.delete(characterId);
            } catch (StorageException e) {
                log.error("Failed to remove character {} after aborted import", characterId, e);
            }
        }
        if (!inserted.isEmpty()) {
            log.warn("Rolled back {} character(s) created by an aborted import", inserted.size());
        }
    }

    /**
     * Envelope sheet id to new character id. Every stored id is appended to
     * {@code inserted} as soon as it exists, so a later failure can undo it.
     */
    private Map<String, String> createCharacters(EncounterPayload source, ImportOptions options, Instant now,
                                                 List<String> inserted) {
        Map<String, String> created = new HashMap<>();
        if (!options.createMissingCharacters() || source.characterSheets() == null) {
            return created;
        }
        for (CharacterSheetPayload sheet : source.characterSheets()) {
            if (sheet.id() != null && created.containsKey(sheet.id())) {
                continue;
            }
            CharacterSheet character = characters.insert(sheet.toCharacter(ids.newId(), options.ownerId(), now));
            inserted.add(character.id());
            if (sheet.id() != null) {
                created.put(sheet.id(), character.id());
            }
        }
        return created;
    }
}
