package in.questkeeper.infrastructure.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import in.questkeeper.application.port.output.CharacterRepository;
import in.questkeeper.application.port.output.StorageException;
import in.questkeeper.domain.character.CharacterSheet;
import in.questkeeper.util.Json;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Array;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;

/**
 * PostgreSQL implementation of CharacterRepository.
 */
public final class PostgresCharacterRepository implements CharacterRepository {
    private static final Logger log = LoggerFactory.getLogger(PostgresCharacterRepository.class);
    private static final ObjectMapper MAPPER = Json.newMapper();

    private final DataSource dataSource;

    public PostgresCharacterRepository(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public Optional<CharacterSheet> findById(String characterId) {
        String sql = "SELECT document FROM characters WHERE id = ?";

        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, characterId);

            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(read(rs.getString("document")));
                }
            }

        } catch (SQLException e) {
            log.error("Error finding character: {}", characterId, e);
            throw new StorageException("Database error", e);
        }

        return Optional.empty();
    }

    @Override
    public List<CharacterSheet> findByIds(Collection<String> characterIds) {
        List<CharacterSheet> characters = new ArrayList<>();
        if (characterIds.isEmpty()) {
            return characters;
        }

        String sql = "SELECT document FROM characters WHERE id = ANY (?)";

        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            Array ids = conn.createArrayOf("varchar", new LinkedHashSet<>(characterIds).toArray());
            ps.setArray(1, ids);

            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    characters.add(read(rs.getString("document")));
                }
            }

        } catch (SQLException e) {
            log.error("Error finding {} characters", characterIds.size(), e);
            throw new StorageException("Database error", e);
        }

        return characters;
    }

    @Override
    public CharacterSheet insert(CharacterSheet character) {
        String sql = "INSERT INTO characters (id, owner_id, document, created_at) VALUES (?, ?, ?::jsonb, ?)";

        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, character.id());
            ps.setString(2, character.ownerId());
            ps.setString(3, MAPPER.writeValueAsString(character));
            Instant created = character.createdAt() != null ? character.createdAt() : Instant.now();
            ps.setTimestamp(4, Timestamp.from(created));

            ps.executeUpdate();
            log.debug("Inserted character: {}", character.id());
            return character;

        } catch (SQLException | JsonProcessingException e) {
            log.error("Error inserting character: {}", character.id(), e);
            throw new StorageException("Database error", e);
        }
    }

    @Override
    public boolean delete(String characterId) {
        String sql = "DELETE FROM characters WHERE id = ?";

        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, characterId);
            return ps.executeUpdate() > 0;

        } catch (SQLException e) {
            log.error("Error deleting character: {}", characterId, e);
            throw new StorageException("Database error", e);
        }
    }

    private static CharacterSheet read(String document) {
        try {
            return MAPPER.readValue(document, CharacterSheet.class);
        } catch (JsonProcessingException e) {
            throw new StorageException("Corrupt character document", e);
        }
    }
}
