package in.questkeeper.domain.template;

import in.questkeeper.domain.export.ExportEnvelope;

import java.time.Instant;

/**
 * Reusable encounter blueprint. Stored envelope is already sanitized.
 */
public record EncounterTemplate(
    String templateId,      // assigned by the store
    String ownerId,
    String name,
    ExportEnvelope envelope,
    Instant createdAt
) {
}
