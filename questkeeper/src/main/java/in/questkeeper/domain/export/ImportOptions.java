package in.questkeeper.domain.export;

/**
 * @param ownerId                 owner of the encounter (and characters) being created
 * @param createMissingCharacters materialize character records from the envelope's sheets
 */
public record ImportOptions(String ownerId, boolean createMissingCharacters) {

    public static ImportOptions forOwner(String ownerId) {
        return new ImportOptions(ownerId, false);
    }
}
