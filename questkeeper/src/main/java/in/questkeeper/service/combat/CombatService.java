package in.questkeeper.service.combat;

import in.questkeeper.application.port.output.CharacterRepository;
import in.questkeeper.application.port.output.StorageException;
import in.questkeeper.domain.character.CharacterSheet;
import in.questkeeper.domain.common.ErrorCode;
import in.questkeeper.domain.common.ServiceError;
import in.questkeeper.domain.common.ServiceResult;
import in.questkeeper.domain.encounter.Encounter;
import in.questkeeper.domain.encounter.Participant;
import in.questkeeper.infrastructure.metrics.EncounterMetrics;
import in.questkeeper.service.access.EncounterLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Runs combat transitions against stored encounters: load, check ownership,
 * apply the transition, write the whole result back once.
 */
public final class CombatService {
    private static final Logger log = LoggerFactory.getLogger(CombatService.class);

    private final EncounterLoader loader;
    private final CombatStateMachine machine;
    private final CharacterRepository characters;
    private final EncounterMetrics metrics;

    public CombatService(EncounterLoader loader, CombatStateMachine machine, CharacterRepository characters,
                         EncounterMetrics metrics) {
        this.loader = loader;
        this.machine = machine;
        this.characters = characters;
        this.metrics = metrics;
    }

    public ServiceResult<Encounter> startCombat(String encounterId, String userId) {
        ServiceResult<Encounter> loaded = loader.loadForOwner(encounterId, userId, "start combat in");
        if (loaded.failed()) {
            return record("start", loaded);
        }
        Encounter encounter = loaded.data();

        Map<String, Integer> dexterity;
        try {
            dexterity = dexterityOf(encounter);
        } catch (StorageException e) {
            log.error("Failed to load characters for encounter {}", encounterId, e);
            return record("start", ServiceResult.fail(ServiceError.storage(ErrorCode.DATABASE_ERROR, e)));
        }

        ServiceResult<Encounter> result = machine.start(encounter, dexterity)
            .flatMap(next -> loader.save(next, ErrorCode.ENCOUNTER_SAVE_FAILED));
        result.onSuccess(e -> log.info("⚔ Combat started in encounter {} with {} combatants",
            encounterId, e.combatState().initiativeOrder().size()));
        return record("start", result);
    }

    public ServiceResult<Encounter> pauseCombat(String encounterId, String userId) {
        return transition("pause", encounterId, userId, machine::pause);
    }

    public ServiceResult<Encounter> resumeCombat(String encounterId, String userId) {
        return transition("resume", encounterId, userId, machine::resume);
    }

    public ServiceResult<Encounter> nextTurn(String encounterId, String userId) {
        return transition("next_turn", encounterId, userId, machine::nextTurn);
    }

    public ServiceResult<Encounter> previousTurn(String encounterId, String userId) {
        return transition("previous_turn", encounterId, userId, machine::previousTurn);
    }

    public ServiceResult<Encounter> endCombat(String encounterId, String userId) {
        return transition("end", encounterId, userId, machine::end);
    }

    public ServiceResult<Encounter> setInitiative(String encounterId, String userId, String participantId,
                                                  int value, Integer dexterity) {
        return transition("set_initiative", encounterId, userId,
            e -> machine.setInitiative(e, participantId, value, dexterity));
    }

    public ServiceResult<Encounter> applyDamage(String encounterId, String userId, String participantId, int amount) {
        return transition("damage", encounterId, userId, e -> machine.applyDamage(e, participantId, amount));
    }

    public ServiceResult<Encounter> applyHealing(String encounterId, String userId, String participantId, int amount) {
        return transition("healing", encounterId, userId, e -> machine.applyHealing(e, participantId, amount));
    }

    public ServiceResult<Encounter> addCondition(String encounterId, String userId, String participantId,
                                                 String condition) {
        return transition("add_condition", encounterId, userId,
            e -> machine.addCondition(e, participantId, condition));
    }

    public ServiceResult<Encounter> removeCondition(String encounterId, String userId, String participantId,
                                                    String condition) {
        return transition("remove_condition", encounterId, userId,
            e -> machine.removeCondition(e, participantId, condition));
    }

    /**
     * Participant whose turn it is. Readable by anyone with read access.
     */
    public ServiceResult<Participant> currentParticipant(String encounterId, String userId) {
        return loader.loadForRead(encounterId, userId, "view").flatMap(e -> {
            Participant current = machine.currentParticipant(e);
            if (current == null) {
                return ServiceResult.fail(ServiceError.combatState("currentParticipant", "combat is not running"));
            }
            return ServiceResult.ok(current);
        });
    }

    private ServiceResult<Encounter> transition(String action, String encounterId, String userId,
                                                Function<Encounter, ServiceResult<Encounter>> step) {
        ServiceResult<Encounter> result = loader.loadForOwner(encounterId, userId, "run combat in")
            .flatMap(step)
            .flatMap(next -> loader.save(next, ErrorCode.ENCOUNTER_SAVE_FAILED));

        if (result.success()) {
            log.info("Combat {} in encounter {} (round {}, turn {})", action, encounterId,
                result.data().combatState().currentRound(), result.data().combatState().currentTurn());
        } else {
            log.warn("Combat {} rejected for encounter {}: {}", action, encounterId, result.error().message());
        }
        return record(action, result);
    }

    private Map<String, Integer> dexterityOf(Encounter encounter) {
        List<String> ids = new ArrayList<>();
        for (Participant p : encounter.participants()) {
            ids.add(p.characterId());
        }
        Map<String, Integer> dexterity = new HashMap<>();
        for (CharacterSheet c : characters.findByIds(ids)) {
            dexterity.put(c.id(), c.dexterity());
        }
        return dexterity;
    }

    private ServiceResult<Encounter> record(String action, ServiceResult<Encounter> result) {
        metrics.recordCombatAction(action, result.success() ? "success" : result.error().code());
        return result;
    }
}
