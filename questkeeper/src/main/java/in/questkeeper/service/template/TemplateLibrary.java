package in.questkeeper.service.template;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import in.questkeeper.application.port.output.StorageException;
import in.questkeeper.application.port.output.TemplateRepository;
import in.questkeeper.domain.common.ErrorCode;
import in.questkeeper.domain.common.ServiceError;
import in.questkeeper.domain.common.ServiceResult;
import in.questkeeper.domain.encounter.Encounter;
import in.questkeeper.domain.export.ExportEnvelope;
import in.questkeeper.domain.export.ImportOptions;
import in.questkeeper.domain.template.EncounterTemplate;
import in.questkeeper.service.transfer.ImportProcessor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Stored templates of one owner. Templates are private to their owner.
 */
public final class TemplateLibrary {
    private static final Logger log = LoggerFactory.getLogger(TemplateLibrary.class);

    private final TemplateRepository templates;
    private final TemplateSanitizer sanitizer;
    private final ImportProcessor importProcessor;
    private final ObjectMapper mapper;

    public TemplateLibrary(TemplateRepository templates, TemplateSanitizer sanitizer,
                           ImportProcessor importProcessor, ObjectMapper mapper) {
        this.templates = templates;
        this.sanitizer = sanitizer;
        this.importProcessor = importProcessor;
        this.mapper = mapper;
    }

    /**
     * Derive a template from an encounter and store it.
     */
    public ServiceResult<EncounterTemplate> createFromEncounter(String encounterId, String userId, String name) {
        return sanitizer.createTemplate(encounterId, userId, name)
            .flatMap(envelope -> save(userId, envelope.encounter().name(), envelope));
    }

    public ServiceResult<EncounterTemplate> save(String ownerId, String name, ExportEnvelope envelope) {
        try {
            EncounterTemplate stored = templates.add(ownerId, name, envelope);
            log.info("✓ Saved template {} '{}' for {}", stored.templateId(), name, ownerId);
            return ServiceResult.ok(stored);
        } catch (StorageException e) {
            log.error("Failed to save template '{}' for {}", name, ownerId, e);
            return ServiceResult.fail(ServiceError.storage(ErrorCode.TEMPLATE_SAVE_FAILED, e));
        }
    }

    public ServiceResult<EncounterTemplate> find(String templateId, String userId) {
        Optional<EncounterTemplate> found;
        try {
            found = templates.find(templateId);
        } catch (StorageException e) {
            log.error("Failed to load template {}", templateId, e);
            return ServiceResult.fail(ServiceError.storage(ErrorCode.DATABASE_ERROR, e));
        }
        if (found.isEmpty()) {
            return ServiceResult.fail(ServiceError.of(ErrorCode.TEMPLATE_NOT_FOUND,
                "Template not found: " + templateId));
        }
        EncounterTemplate template = found.get();
        if (!template.ownerId().equals(userId)) {
            log.warn("User {} denied access to template {}", userId, templateId);
            return ServiceResult.fail(ServiceError.permissionDenied("Only the owner can use this template"));
        }
        return ServiceResult.ok(template);
    }

    public ServiceResult<List<EncounterTemplate>> findByOwner(String ownerId) {
        try {
            return ServiceResult.ok(templates.findByOwner(ownerId));
        } catch (StorageException e) {
            log.error("Failed to list templates of {}", ownerId, e);
            return ServiceResult.fail(ServiceError.storage(ErrorCode.DATABASE_ERROR, e));
        }
    }

    public ServiceResult<Boolean> remove(String templateId, String userId) {
        return find(templateId, userId).flatMap(template -> {
            try {
                boolean removed = templates.remove(templateId);
                log.info("Removed template {} for {}", templateId, userId);
                return ServiceResult.ok(removed);
            } catch (StorageException e) {
                log.error("Failed to remove template {}", templateId, e);
                return ServiceResult.fail(ServiceError.storage(ErrorCode.DATABASE_ERROR, e));
            }
        });
    }

    /**
     * Create a fresh draft encounter from a stored template.
     */
    public ServiceResult<Encounter> instantiate(String templateId, String ownerId) {
        return find(templateId, ownerId).flatMap(template -> {
            JsonNode tree = mapper.valueToTree(template.envelope());
            return importProcessor.importEnvelope(tree, ImportOptions.forOwner(ownerId));
        });
    }
}
