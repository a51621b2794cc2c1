package in.questkeeper.domain.export;

/**
 * Flags controlling what an export carries.
 *
 * stripPersonalData wins over includePrivateNotes.
 */
public record ExportOptions(
    boolean includeCharacterSheets,
    boolean includePrivateNotes,
    boolean includeIds,
    boolean stripPersonalData
) {
    public static ExportOptions defaults() {
        return new ExportOptions(false, false, false, false);
    }

    /**
     * Full-fidelity export: sheets, notes and real ids.
     */
    public static ExportOptions complete() {
        return new ExportOptions(true, true, true, false);
    }

    /**
     * Options used when deriving a template.
     */
    public static ExportOptions forTemplate() {
        return new ExportOptions(false, false, false, true);
    }
}
