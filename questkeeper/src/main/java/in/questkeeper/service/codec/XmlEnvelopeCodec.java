package in.questkeeper.service.codec;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import in.questkeeper.domain.common.ServiceError;
import in.questkeeper.domain.common.ServiceResult;
import in.questkeeper.domain.export.ExportEnvelope;
import in.questkeeper.domain.export.ExportFormat;
import in.questkeeper.service.schema.EnvelopeSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * XML form of the envelope under root element {@code encounterExport}.
 *
 * Decoding reads leaves as text and lets the envelope schema restore arrays,
 * numbers and booleans, so single-item and empty arrays and numeric-looking
 * strings survive the round trip.
 */
public final class XmlEnvelopeCodec implements EnvelopeCodec {
    private static final Logger log = LoggerFactory.getLogger(XmlEnvelopeCodec.class);

    public static final String ROOT = "encounterExport";

    private final ObjectMapper mapper;
    private final EnvelopeSchema schema;
    private final XmlWriter writer = new XmlWriter();

    public XmlEnvelopeCodec(ObjectMapper mapper, EnvelopeSchema schema) {
        this.mapper = mapper;
        this.schema = schema;
    }

    @Override
    public ExportFormat format() {
        return ExportFormat.XML;
    }

    @Override
    public String encode(ExportEnvelope envelope) {
        return writer.write(ROOT, mapper.valueToTree(envelope));
    }

    @Override
    public ServiceResult<JsonNode> decode(String payload) {
        try {
            JsonNode tree = XmlTreeReader.read(payload, false);
            return ServiceResult.ok(schema.conform(tree));
        } catch (XmlFormatException e) {
            log.warn("Rejected malformed XML import: {}", e.getMessage());
            return ServiceResult.fail(ServiceError.format("Invalid XML format: " + e.getMessage()));
        }
    }
}
