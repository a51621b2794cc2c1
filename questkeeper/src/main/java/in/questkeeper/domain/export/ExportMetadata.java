package in.questkeeper.domain.export;

public record ExportMetadata(
    String exportedAt,      // ISO-8601
    String exportedBy,
    ExportFormat format,
    String version,         // envelope schema version
    String appVersion
) {
}
