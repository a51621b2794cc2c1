package in.questkeeper.infrastructure.persistence;

import in.questkeeper.application.port.output.IdGenerator;
import in.questkeeper.application.port.output.TemplateRepository;
import in.questkeeper.domain.export.ExportEnvelope;
import in.questkeeper.domain.template.EncounterTemplate;

import java.time.Clock;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

public final class InMemoryTemplateRepository implements TemplateRepository {

    private final Map<String, EncounterTemplate> templates = new ConcurrentHashMap<>();
    private final IdGenerator ids;
    private final Clock clock;

    public InMemoryTemplateRepository(IdGenerator ids, Clock clock) {
        this.ids = ids;
        this.clock = clock;
    }

    @Override
    public EncounterTemplate add(String ownerId, String name, ExportEnvelope envelope) {
        EncounterTemplate template = new EncounterTemplate(ids.newId(), ownerId, name, envelope, clock.instant());
        templates.put(template.templateId(), template);
        return template;
    }

    @Override
    public Optional<EncounterTemplate> find(String templateId) {
        return Optional.ofNullable(templates.get(templateId));
    }

    @Override
    public List<EncounterTemplate> findByOwner(String ownerId) {
        return templates.values().stream()
            .filter(t -> t.ownerId().equals(ownerId))
            .sorted(Comparator.comparing(EncounterTemplate::createdAt))
            .collect(Collectors.toList());
    }

    @Override
    public boolean remove(String templateId) {
        return templates.remove(templateId) != null;
    }
}
