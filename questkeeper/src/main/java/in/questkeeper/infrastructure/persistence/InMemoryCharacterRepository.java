package in.questkeeper.infrastructure.persistence;

import in.questkeeper.application.port.output.CharacterRepository;
import in.questkeeper.application.port.output.StorageException;
import in.questkeeper.domain.character.CharacterSheet;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public final class InMemoryCharacterRepository implements CharacterRepository {

    private final Map<String, CharacterSheet> characters = new ConcurrentHashMap<>();

    @Override
    public Optional<CharacterSheet> findById(String characterId) {
        return Optional.ofNullable(characters.get(characterId));
    }

    @Override
    public List<CharacterSheet> findByIds(Collection<String> characterIds) {
        List<CharacterSheet> found = new ArrayList<>();
        for (String id : new LinkedHashSet<>(characterIds)) {
            CharacterSheet c = characters.get(id);
            if (c != null) {
                found.add(c);
            }
        }
        return found;
    }

    @Override
    public CharacterSheet insert(CharacterSheet character) {
        if (characters.putIfAbsent(character.id(), character) != null) {
            throw new StorageException("Duplicate character id: " + character.id(), null);
        }
        return character;
    }

    @Override
    public boolean delete(String characterId) {
        return characters.remove(characterId) != null;
    }
}
