package in.questkeeper.domain.export;

/**
 * Self-contained snapshot of an encounter, independent of live storage.
 */
public record ExportEnvelope(ExportMetadata metadata, EncounterPayload encounter) {

    public static final String SCHEMA_VERSION = "1.0.0";
}
