package in.questkeeper.service.codec;

import com.fasterxml.jackson.databind.ObjectMapper;
import in.questkeeper.domain.export.ExportFormat;
import in.questkeeper.service.schema.EnvelopeSchema;

import java.util.EnumMap;
import java.util.Map;

/**
 * Codec lookup by format.
 */
public final class EnvelopeCodecs {

    private final Map<ExportFormat, EnvelopeCodec> codecs = new EnumMap<>(ExportFormat.class);

    public EnvelopeCodecs(ObjectMapper mapper, EnvelopeSchema schema) {
        register(new JsonEnvelopeCodec(mapper));
        register(new XmlEnvelopeCodec(mapper, schema));
    }

    private void register(EnvelopeCodec codec) {
        codecs.put(codec.format(), codec);
    }

    public EnvelopeCodec forFormat(ExportFormat format) {
        EnvelopeCodec codec = codecs.get(format);
        if (codec == null) {
            throw new IllegalArgumentException("No codec for format " + format);
        }
        return codec;
    }
}
