package in.questkeeper.domain.export;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum ExportFormat {
    JSON("json", "application/json"),
    XML("xml", "application/xml");

    private final String wire;
    private final String contentType;

    ExportFormat(String wire, String contentType) {
        this.wire = wire;
        this.contentType = contentType;
    }

    @JsonValue
    public String wire() {
        return wire;
    }

    public String contentType() {
        return contentType;
    }

    @JsonCreator
    public static ExportFormat fromWire(String value) {
        for (ExportFormat f : values()) {
            if (f.wire.equalsIgnoreCase(value)) {
                return f;
            }
        }
        throw new IllegalArgumentException("Unsupported format: " + value);
    }
}
