package in.questkeeper.service.transfer;

import com.fasterxml.jackson.databind.JsonNode;
import in.questkeeper.domain.common.ServiceResult;
import in.questkeeper.domain.encounter.Encounter;
import in.questkeeper.domain.export.ExportFormat;
import in.questkeeper.domain.export.ExportOptions;
import in.questkeeper.domain.export.ImportOptions;
import in.questkeeper.infrastructure.metrics.EncounterMetrics;
import in.questkeeper.service.codec.EnvelopeCodec;
import in.questkeeper.service.codec.EnvelopeCodecs;
import in.questkeeper.service.export.ExportBuilder;

/**
 * Text-level export and import: builder or processor plus the format codec.
 */
public final class EncounterTransferService {

    private final ExportBuilder exportBuilder;
    private final ImportProcessor importProcessor;
    private final EnvelopeCodecs codecs;
    private final EncounterMetrics metrics;

    public EncounterTransferService(ExportBuilder exportBuilder, ImportProcessor importProcessor,
                                    EnvelopeCodecs codecs, EncounterMetrics metrics) {
        this.exportBuilder = exportBuilder;
        this.importProcessor = importProcessor;
        this.codecs = codecs;
        this.metrics = metrics;
    }

    public ServiceResult<String> export(String encounterId, String userId, ExportFormat format,
                                        ExportOptions options) {
        EnvelopeCodec codec = codecs.forFormat(format);
        ServiceResult<String> result = exportBuilder.prepareExport(encounterId, userId, format, options)
            .map(codec::encode);
        metrics.recordExport(format.wire(), outcome(result));
        return result;
    }

    public ServiceResult<Encounter> importFrom(String payload, ExportFormat format, ImportOptions options) {
        ServiceResult<JsonNode> parsed = codecs.forFormat(format).decode(payload);
        ServiceResult<Encounter> result = parsed.flatMap(tree -> importProcessor.importEnvelope(tree, options));
        metrics.recordImport(format.wire(), outcome(result));
        return result;
    }

    private static String outcome(ServiceResult<?> result) {
        return result.success() ? "success" : result.error().code();
    }
}
