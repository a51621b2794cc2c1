package in.questkeeper.service.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import in.questkeeper.domain.common.ServiceError;
import in.questkeeper.domain.common.ServiceResult;
import in.questkeeper.domain.export.ExportEnvelope;
import in.questkeeper.domain.export.ExportFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class JsonEnvelopeCodec implements EnvelopeCodec {
    private static final Logger log = LoggerFactory.getLogger(JsonEnvelopeCodec.class);

    private final ObjectMapper mapper;

    public JsonEnvelopeCodec(ObjectMapper mapper) {
        this.mapper = mapper.copy().enable(SerializationFeature.INDENT_OUTPUT);
    }

    @Override
    public ExportFormat format() {
        return ExportFormat.JSON;
    }

    @Override
    public String encode(ExportEnvelope envelope) {
        try {
            return mapper.writeValueAsString(envelope);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize envelope", e);
        }
    }

    @Override
    public ServiceResult<JsonNode> decode(String payload) {
        if (payload == null || payload.isBlank()) {
            return ServiceResult.fail(ServiceError.format("Invalid JSON format: empty payload"));
        }
        try {
            return ServiceResult.ok(mapper.readTree(payload));
        } catch (JsonProcessingException e) {
            log.warn("Rejected malformed JSON import: {}", e.getOriginalMessage());
            return ServiceResult.fail(ServiceError.format("Invalid JSON format: " + e.getOriginalMessage()));
        }
    }
}
