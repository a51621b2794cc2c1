package in.questkeeper.infrastructure.persistence;

import in.questkeeper.application.port.output.EncounterRepository;
import in.questkeeper.application.port.output.StorageException;
import in.questkeeper.domain.encounter.Encounter;

import java.time.Clock;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Process-local encounter store. Version checks run inside
 * {@link ConcurrentHashMap#compute} so replacement is atomic.
 */
public final class InMemoryEncounterRepository implements EncounterRepository {

    private final Map<String, Encounter> encounters = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryEncounterRepository(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Optional<Encounter> findById(String encounterId) {
        return Optional.ofNullable(encounters.get(encounterId));
    }

    @Override
    public List<Encounter> findByOwner(String ownerId) {
        return encounters.values().stream()
            .filter(e -> e.isOwnedBy(ownerId))
            .sorted(Comparator.comparing(Encounter::createdAt, Comparator.nullsLast(Comparator.reverseOrder())))
            .collect(Collectors.toList());
    }

    @Override
    public Encounter insert(Encounter encounter) {
        Encounter existing = encounters.putIfAbsent(encounter.id(), encounter);
        if (existing != null) {
            throw new StorageException("Duplicate encounter id: " + encounter.id(), null);
        }
        return encounter;
    }

    @Override
    public Encounter update(Encounter encounter) {
        return encounters.compute(encounter.id(), (id, stored) -> {
            if (stored == null) {
                throw new StorageException("Encounter no longer exists: " + id, null);
            }
            if (stored.version() != encounter.version()) {
                throw StorageException.conflict(id, encounter.version());
            }
            return encounter.withStored(encounter.version() + 1, clock.instant());
        });
    }

    @Override
    public boolean delete(String encounterId) {
        return encounters.remove(encounterId) != null;
    }
}
