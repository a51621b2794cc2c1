package in.questkeeper.service.schema;

import com.fasterxml.jackson.databind.JsonNode;
import in.questkeeper.domain.common.FieldError;

import java.util.ArrayList;
import java.util.List;

import static in.questkeeper.service.schema.Schemas.array;
import static in.questkeeper.service.schema.Schemas.bool;
import static in.questkeeper.service.schema.Schemas.integer;
import static in.questkeeper.service.schema.Schemas.map;
import static in.questkeeper.service.schema.Schemas.number;
import static in.questkeeper.service.schema.Schemas.object;
import static in.questkeeper.service.schema.Schemas.oneOf;
import static in.questkeeper.service.schema.Schemas.string;
import static in.questkeeper.service.schema.Schemas.url;

/**
 * Structure and bounds of an encounter export envelope.
 */
public final class EnvelopeSchema {

    private static final SchemaNode SIX_SCORES = object()
        .required("strength", integer(1, 30))
        .required("dexterity", integer(1, 30))
        .required("constitution", integer(1, 30))
        .required("intelligence", integer(1, 30))
        .required("wisdom", integer(1, 30))
        .required("charisma", integer(1, 30));

    private static final SchemaNode SIX_PROFICIENCIES = object()
        .required("strength", bool())
        .required("dexterity", bool())
        .required("constitution", bool())
        .required("intelligence", bool())
        .required("wisdom", bool())
        .required("charisma", bool());

    private static final SchemaNode SETTINGS = object()
        .required("allowPlayerVisibility", bool())
        .required("autoRollInitiative", bool())
        .required("trackResources", bool())
        .required("enableLairActions", bool())
        .optional("lairActionInitiative", integer(1, 30))
        .required("enableGridMovement", bool())
        .required("gridSize", integer(1, 50))
        .optional("roundTimeLimit", integer(30, 600))
        .optional("experienceThreshold", integer(0, 30));

    private static final SchemaNode INITIATIVE_ENTRY = object()
        .required("participantId", string())
        .required("initiative", integer(1, 30))
        .required("dexterity", integer(1, 30))
        .required("isActive", bool())
        .required("hasActed", bool())
        .optional("isDelayed", bool())
        .optional("readyAction", string());

    private static final SchemaNode COMBAT_STATE = object()
        .required("isActive", bool())
        .required("currentRound", integer(0))
        .required("currentTurn", integer(0))
        .required("totalDuration", integer(0))
        .optional("startedAt", string())
        .optional("pausedAt", string())
        .optional("endedAt", string())
        .required("initiativeOrder", array(INITIATIVE_ENTRY, Integer.MAX_VALUE));

    private static final SchemaNode PARTICIPANT = object()
        .required("id", string())
        .required("name", string(1, 100))
        .required("type", oneOf("pc", "npc", "monster"))
        .required("maxHitPoints", integer(1, 999))
        .required("currentHitPoints", integer(-999, 999))
        .required("temporaryHitPoints", integer(0, 999))
        .required("armorClass", integer(1, 30))
        .optional("initiative", integer(1, 30))
        .required("isPlayer", bool())
        .required("isVisible", bool())
        .required("notes", string(0, 500))
        .required("conditions", array(string(0, 50), 20))
        .optional("position", object()
            .required("x", integer(0))
            .required("y", integer(0)));

    private static final SchemaNode CHARACTER_SHEET = object()
        .required("id", string())
        .required("name", string(1, 100))
        .required("type", oneOf("pc", "npc"))
        .required("race", string(1, 50))
        .optional("customRace", string(0, 50))
        .required("size", oneOf("tiny", "small", "medium", "large", "huge", "gargantuan"))
        .required("classes", array(object()
            .required("class", string(1, 50))
            .required("level", integer(1, 20))
            .optional("subclass", string(0, 50))
            .required("hitDie", integer(4, 12)), 1, 5))
        .required("abilityScores", SIX_SCORES)
        .required("hitPoints", object()
            .required("maximum", integer(1, 999))
            .required("current", integer(-999, 999))
            .required("temporary", integer(0, 999)))
        .required("armorClass", integer(1, 30))
        .required("speed", integer(0, 200))
        .required("proficiencyBonus", integer(2, 6))
        .required("savingThrows", SIX_PROFICIENCIES)
        .required("skills", map(bool()))
        .required("equipment", array(object()
            .required("name", string(1, 100))
            .required("quantity", integer(0, 999))
            .required("weight", number(0, 999))
            .required("value", integer(0, 999999))
            .optional("description", string(0, 500))
            .required("equipped", bool())
            .required("magical", bool()), 200))
        .required("spells", array(object()
            .required("name", string(1, 100))
            .required("level", integer(0, 9))
            .required("school", string(1, 50))
            .required("castingTime", string(1, 100))
            .required("range", string(1, 100))
            .required("components", string(1, 100))
            .required("duration", string(1, 100))
            .required("description", string(1, 2000))
            .required("isPrepared", bool()), 500))
        .required("backstory", string(0, 10000))
        .required("notes", string(0, 2000))
        .optional("imageUrl", url());

    private static final SchemaNode ENVELOPE = object()
        .required("metadata", object()
            .required("exportedAt", string())
            .required("exportedBy", string())
            .required("format", oneOf("json", "xml"))
            .required("version", string())
            .required("appVersion", string()))
        .required("encounter", object()
            .required("name", string(1, 100))
            .required("description", string(0, 1000))
            .required("tags", array(string(0, 30), 10))
            .optional("difficulty", oneOf("trivial", "easy", "medium", "hard", "deadly"))
            .optional("estimatedDuration", integer(1, 480))
            .optional("targetLevel", integer(1, 20))
            .required("status", oneOf("draft", "active", "completed", "archived"))
            .required("isPublic", bool())
            .required("settings", SETTINGS)
            .optional("combatState", COMBAT_STATE)
            .required("participants", array(PARTICIPANT, 50))
            .optional("characterSheets", array(CHARACTER_SHEET, Integer.MAX_VALUE)));

    /**
     * All violations in document order; empty when the envelope is well-formed.
     */
    public List<FieldError> validate(JsonNode envelope) {
        List<FieldError> errors = new ArrayList<>();
        if (envelope == null || envelope.isNull() || envelope.isMissingNode()) {
            errors.add(FieldError.of("", "Required"));
            return errors;
        }
        ENVELOPE.validate(envelope, "", errors);
        return errors;
    }

    /**
     * Re-type a text-only tree against the envelope structure.
     */
    public JsonNode conform(JsonNode tree) {
        return ENVELOPE.conform(tree);
    }
}
