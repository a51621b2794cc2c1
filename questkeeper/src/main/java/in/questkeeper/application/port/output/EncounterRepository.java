package in.questkeeper.application.port.output;

import in.questkeeper.domain.encounter.Encounter;

import java.util.List;
import java.util.Optional;

/**
 * Document store for encounters.
 *
 * All methods may throw {@link StorageException}.
 */
public interface EncounterRepository {

    /**
     * Find encounter by ID.
     */
    Optional<Encounter> findById(String encounterId);

    /**
     * Find all encounters owned by a user, newest first.
     */
    List<Encounter> findByOwner(String ownerId);

    /**
     * Insert a new encounter. Returns the stored value.
     */
    Encounter insert(Encounter encounter);

    /**
     * Replace an encounter if its stored version still equals encounter.version().
     * Returns the stored value with the incremented version.
     *
     * @throws StorageException with isConflict() set when the version moved on
     */
    Encounter update(Encounter encounter);

    /**
     * Delete an encounter. Returns false if it did not exist.
     */
    boolean delete(String encounterId);
}
