package in.questkeeper.service.export;

import in.questkeeper.application.port.output.CharacterRepository;
import in.questkeeper.application.port.output.IdGenerator;
import in.questkeeper.application.port.output.StorageException;
import in.questkeeper.domain.character.CharacterSheet;
import in.questkeeper.domain.common.ErrorCode;
import in.questkeeper.domain.common.ServiceError;
import in.questkeeper.domain.common.ServiceResult;
import in.questkeeper.domain.encounter.CombatPhase;
import in.questkeeper.domain.encounter.CombatState;
import in.questkeeper.domain.encounter.Encounter;
import in.questkeeper.domain.encounter.InitiativeEntry;
import in.questkeeper.domain.encounter.Participant;
import in.questkeeper.domain.export.CharacterSheetPayload;
import in.questkeeper.domain.export.CombatStatePayload;
import in.questkeeper.domain.export.EncounterPayload;
import in.questkeeper.domain.export.ExportEnvelope;
import in.questkeeper.domain.export.ExportFormat;
import in.questkeeper.domain.export.ExportMetadata;
import in.questkeeper.domain.export.ExportOptions;
import in.questkeeper.domain.export.ParticipantPayload;
import in.questkeeper.service.access.EncounterLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Assembles export envelopes from stored encounters.
 *
 * Access is checked before anything beyond the encounter header is read.
 * Serialization is left to the codecs.
 */
public final class ExportBuilder {
    private static final Logger log = LoggerFactory.getLogger(ExportBuilder.class);

    private final EncounterLoader loader;
    private final CharacterRepository characters;
    private final IdGenerator tempIds;
    private final Clock clock;
    private final String appVersion;

    public ExportBuilder(EncounterLoader loader, CharacterRepository characters, IdGenerator tempIds,
                         Clock clock, String appVersion) {
        this.loader = loader;
        this.characters = characters;
        this.tempIds = tempIds;
        this.clock = clock;
        this.appVersion = appVersion;
    }

    public ServiceResult<ExportEnvelope> prepareExport(String encounterId, String userId, ExportFormat format,
                                                       ExportOptions options) {
        ServiceResult<Encounter> loaded = loader.loadForRead(encounterId, userId, "export");
        if (loaded.failed()) {
            return loaded.propagate();
        }
        Encounter encounter = loaded.data();
        IdMapper ids = new IdMapper(options.includeIds());

        List<CharacterSheetPayload> sheets = null;
        if (options.includeCharacterSheets()) {
            try {
                sheets = characterSheets(encounter, ids, options);
            } catch (StorageException e) {
                log.error("Failed to load character sheets for export of {}", encounterId, e);
                return ServiceResult.fail(ServiceError.storage(ErrorCode.ENCOUNTER_EXPORT_FAILED, e));
            }
        }

        boolean keepNotes = options.includePrivateNotes() && !options.stripPersonalData();
        List<ParticipantPayload> participants = new ArrayList<>(encounter.participants().size());
        for (Participant p : encounter.participants()) {
            participants.add(new ParticipantPayload(
                ids.map(p.characterId()), p.name(), p.type(),
                p.maxHitPoints(), p.currentHitPoints(), p.temporaryHitPoints(), p.armorClass(),
                p.initiative(), p.isPlayer(), p.isVisible(),
                keepNotes ? p.notes() : "",
                p.conditions(), p.position()));
        }

        EncounterPayload payload = new EncounterPayload(
            encounter.name(), encounter.description(), encounter.tags(), encounter.difficulty(),
            encounter.estimatedDuration(), encounter.targetLevel(), encounter.status(), encounter.isPublic(),
            encounter.settings(), combatState(encounter.combatState(), ids), participants, sheets);

        ExportMetadata metadata = new ExportMetadata(clock.instant().toString(), userId, format,
            ExportEnvelope.SCHEMA_VERSION, appVersion);

        log.info("Prepared {} export of encounter {} for {} ({} participants, sheets={}, ids={})",
            format.wire(), encounterId, userId, participants.size(),
            sheets == null ? 0 : sheets.size(), options.includeIds());
        return ServiceResult.ok(new ExportEnvelope(metadata, payload));
    }

    private CombatStatePayload combatState(CombatState state, IdMapper ids) {
        if (!state.hasStarted()) {
            return null;
        }
        List<InitiativeEntry> order = new ArrayList<>(state.initiativeOrder().size());
        for (InitiativeEntry entry : state.initiativeOrder()) {
            order.add(entry.withParticipantId(ids.map(entry.participantId())));
        }
        long duration = state.totalDurationMs();
        if (state.phase() == CombatPhase.ACTIVE && state.lastResumedAt() != null) {
            duration += Math.max(0L, Duration.between(state.lastResumedAt(), clock.instant()).toMillis());
        }
        return new CombatStatePayload(state.isActive(), state.currentRound(), state.currentTurn(), duration,
            iso(state.startedAt()), iso(state.pausedAt()), iso(state.endedAt()), order);
    }

    /**
     * One repository call over the distinct referenced ids.
     */
    private List<CharacterSheetPayload> characterSheets(Encounter encounter, IdMapper ids, ExportOptions options) {
        Set<String> referenced = new LinkedHashSet<>();
        for (Participant p : encounter.participants()) {
            referenced.add(p.characterId());
        }
        List<CharacterSheetPayload> sheets = new ArrayList<>();
        if (referenced.isEmpty()) {
            return sheets;
        }
        for (CharacterSheet c : characters.findByIds(referenced)) {
            sheets.add(CharacterSheetPayload.from(c, ids.map(c.id()), options.stripPersonalData(),
                options.includePrivateNotes()));
        }
        return sheets;
    }

    private static String iso(Instant instant) {
        return instant == null ? null : instant.toString();
    }

    /**
     * Real id to exported id for a single export. Without includeIds every real id
     * gets a temporary id, the same one wherever it appears in this envelope.
     */
    private final class IdMapper {
        private final boolean keepReal;
        private final Map<String, String> assigned = new HashMap<>();
        private final Set<String> issued = new HashSet<>();

        IdMapper(boolean keepReal) {
            this.keepReal = keepReal;
        }

        String map(String realId) {
            if (keepReal) {
                return realId;
            }
            String existing = assigned.get(realId);
            if (existing != null) {
                return existing;
            }
            String temp;
            do {
                temp = tempIds.newId();
            } while (!issued.add(temp));
            assigned.put(realId, temp);
            return temp;
        }
    }
}
