package in.questkeeper.application.port.output;

import in.questkeeper.domain.character.CharacterSheet;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Character records referenced by encounter participants.
 */
public interface CharacterRepository {

    /**
     * Find character by ID.
     */
    Optional<CharacterSheet> findById(String characterId);

    /**
     * Fetch many characters in one call. Unknown ids are skipped.
     */
    List<CharacterSheet> findByIds(Collection<String> characterIds);

    /**
     * Insert a new character.
     */
    CharacterSheet insert(CharacterSheet character);

    /**
     * Delete a character. Returns false if it did not exist.
     */
    boolean delete(String characterId);
}
