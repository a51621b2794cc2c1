package in.questkeeper.service.combat;

import in.questkeeper.domain.character.AbilityScores;

import java.security.SecureRandom;
import java.util.Random;

/**
 * d20 + dexterity modifier, clamped to the valid initiative range.
 */
public class InitiativeRoller {

    private final Random random;

    public InitiativeRoller() {
        this(new SecureRandom());
    }

    public InitiativeRoller(Random random) {
        this.random = random;
    }

    public int roll(int dexterity) {
        int d20 = random.nextInt(20) + 1;
        int total = d20 + AbilityScores.modifier(dexterity);
        return Math.max(1, Math.min(30, total));
    }
}
