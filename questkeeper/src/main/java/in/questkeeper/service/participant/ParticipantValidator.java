package in.questkeeper.service.participant;

import in.questkeeper.domain.common.ValidationResult;
import in.questkeeper.domain.encounter.Participant;
import in.questkeeper.util.Ids;

/**
 * Field rules for participants entering or changing inside an encounter.
 */
public final class ParticipantValidator {

    public static final int MAX_NAME = 100;
    public static final int MAX_HIT_POINTS = 999;
    public static final int MAX_NOTES = 500;
    public static final int MAX_CONDITIONS = 20;
    public static final int MAX_CONDITION_LENGTH = 50;
    public static final int MIN_ARMOR_CLASS = 1;
    public static final int MAX_ARMOR_CLASS = 30;
    public static final int MIN_INITIATIVE = 1;
    public static final int MAX_INITIATIVE = 30;

    /**
     * Validate every field; all violations are reported.
     *
     * @param prefix field path prefix, empty for a single participant
     */
    public ValidationResult validate(Participant p, String prefix) {
        ValidationResult.Builder b = new ValidationResult.Builder(prefix);

        if (!Ids.isValid(p.characterId())) {
            b.addError("characterId", "Invalid character id: " + p.characterId());
        }
        b.requireText("name", p.name(), 1, MAX_NAME);
        if (p.type() == null) {
            b.addError("type", "Required");
        }
        b.range("maxHitPoints", p.maxHitPoints(), 1, MAX_HIT_POINTS);
        b.range("currentHitPoints", p.currentHitPoints(), -MAX_HIT_POINTS, MAX_HIT_POINTS);
        b.range("temporaryHitPoints", p.temporaryHitPoints(), 0, MAX_HIT_POINTS);
        b.range("armorClass", p.armorClass(), MIN_ARMOR_CLASS, MAX_ARMOR_CLASS);
        b.range("initiative", p.initiative(), MIN_INITIATIVE, MAX_INITIATIVE);
        b.maxLength("notes", p.notes(), MAX_NOTES);

        if (p.conditions().size() > MAX_CONDITIONS) {
            b.addError("conditions", "At most " + MAX_CONDITIONS + " conditions allowed");
        }
        for (int i = 0; i < p.conditions().size(); i++) {
            b.requireText("conditions." + i, p.conditions().get(i), 1, MAX_CONDITION_LENGTH);
        }

        if (p.position() != null) {
            if (p.position().x() < 0) {
                b.addError("position.x", "Must be greater than or equal to 0");
            }
            if (p.position().y() < 0) {
                b.addError("position.y", "Must be greater than or equal to 0");
            }
        }

        return b.build();
    }

    public ValidationResult validate(Participant p) {
        return validate(p, "");
    }
}
