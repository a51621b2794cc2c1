package in.questkeeper.domain.character;

/**
 * Saving throw proficiencies.
 */
public record SavingThrows(
    boolean strength,
    boolean dexterity,
    boolean constitution,
    boolean intelligence,
    boolean wisdom,
    boolean charisma
) {
    public static SavingThrows none() {
        return new SavingThrows(false, false, false, false, false, false);
    }
}
