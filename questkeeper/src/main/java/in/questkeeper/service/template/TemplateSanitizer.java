package in.questkeeper.service.template;

import in.questkeeper.domain.common.ServiceError;
import in.questkeeper.domain.common.ServiceResult;
import in.questkeeper.domain.common.ValidationResult;
import in.questkeeper.domain.encounter.EncounterStatus;
import in.questkeeper.domain.export.CombatStatePayload;
import in.questkeeper.domain.export.EncounterPayload;
import in.questkeeper.domain.export.ExportEnvelope;
import in.questkeeper.domain.export.ExportFormat;
import in.questkeeper.domain.export.ExportOptions;
import in.questkeeper.domain.export.ParticipantPayload;
import in.questkeeper.service.export.ExportBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Derives reusable templates: an export with combat progress and personal data removed.
 */
public final class TemplateSanitizer {
    private static final Logger log = LoggerFactory.getLogger(TemplateSanitizer.class);

    public static final int MAX_TEMPLATE_NAME = 100;

    private final ExportBuilder exportBuilder;

    public TemplateSanitizer(ExportBuilder exportBuilder) {
        this.exportBuilder = exportBuilder;
    }

    public ServiceResult<ExportEnvelope> createTemplate(String encounterId, String userId, String templateName) {
        ValidationResult name = new ValidationResult.Builder("")
            .requireText("name", templateName, 1, MAX_TEMPLATE_NAME)
            .build();
        if (!name.passed()) {
            return ServiceResult.fail(ServiceError.validation("Invalid template name", name.errors()));
        }

        return exportBuilder.prepareExport(encounterId, userId, ExportFormat.JSON, ExportOptions.forTemplate())
            .map(envelope -> sanitize(envelope, templateName.trim()))
            .onSuccess(t -> log.info("Derived template '{}' from encounter {} for {}",
                t.encounter().name(), encounterId, userId));
    }

    static ExportEnvelope sanitize(ExportEnvelope envelope, String templateName) {
        EncounterPayload source = envelope.encounter();
        List<ParticipantPayload> participants = new ArrayList<>(source.participants().size());
        for (ParticipantPayload p : source.participants()) {
            participants.add(p.sanitized());
        }
        EncounterPayload template = new EncounterPayload(
            templateName,
            "Template created from: " + source.name(),
            source.tags(), source.difficulty(), source.estimatedDuration(), source.targetLevel(),
            EncounterStatus.DRAFT, false, source.settings(),
            CombatStatePayload.empty(), participants, null);
        return new ExportEnvelope(envelope.metadata(), template);
    }
}
