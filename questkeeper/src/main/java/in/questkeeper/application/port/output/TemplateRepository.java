package in.questkeeper.application.port.output;

import in.questkeeper.domain.export.ExportEnvelope;
import in.questkeeper.domain.template.EncounterTemplate;

import java.util.List;
import java.util.Optional;

/**
 * Template store. Identifiers are generated by the store.
 */
public interface TemplateRepository {

    /**
     * Store a template and return it with its new id.
     */
    EncounterTemplate add(String ownerId, String name, ExportEnvelope envelope);

    Optional<EncounterTemplate> find(String templateId);

    List<EncounterTemplate> findByOwner(String ownerId);

    /**
     * Remove a template. Returns false if it did not exist.
     */
    boolean remove(String templateId);
}
