package in.questkeeper.domain.character;

public record AbilityScores(
    int strength,
    int dexterity,
    int constitution,
    int intelligence,
    int wisdom,
    int charisma
) {
    public static AbilityScores average() {
        return new AbilityScores(10, 10, 10, 10, 10, 10);
    }

    /**
     * Standard ability modifier, floor((score - 10) / 2).
     */
    public static int modifier(int score) {
        return Math.floorDiv(score - 10, 2);
    }
}
