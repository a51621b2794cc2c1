package in.questkeeper.service.codec;

import com.fasterxml.jackson.databind.JsonNode;
import in.questkeeper.domain.common.ServiceResult;
import in.questkeeper.domain.export.ExportEnvelope;
import in.questkeeper.domain.export.ExportFormat;

/**
 * Text serialization of export envelopes.
 */
public interface EnvelopeCodec {

    ExportFormat format();

    /**
     * Serialize an envelope. Never fails for a well-formed envelope.
     */
    String encode(ExportEnvelope envelope);

    /**
     * Parse text into a generic tree ready for schema validation.
     * Malformed input fails with a FORMAT error.
     */
    ServiceResult<JsonNode> decode(String payload);
}
