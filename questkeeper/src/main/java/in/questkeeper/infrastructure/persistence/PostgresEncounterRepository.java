package in.questkeeper.infrastructure.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import in.questkeeper.application.port.output.EncounterRepository;
import in.questkeeper.application.port.output.StorageException;
import in.questkeeper.domain.encounter.Encounter;
import in.questkeeper.util.Json;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * PostgreSQL implementation of EncounterRepository.
 *
 * The whole aggregate is one JSONB document; version is mirrored in a column
 * so the compare-and-replace happens in a single UPDATE.
 */
public final class PostgresEncounterRepository implements EncounterRepository {
    private static final Logger log = LoggerFactory.getLogger(PostgresEncounterRepository.class);
    private static final ObjectMapper MAPPER = Json.newMapper();

    private final DataSource dataSource;
    private final Clock clock;

    public PostgresEncounterRepository(DataSource dataSource, Clock clock) {
        this.dataSource = dataSource;
        this.clock = clock;
    }

    @Override
    public Optional<Encounter> findById(String encounterId) {
        String sql = "SELECT document FROM encounters WHERE id = ?";

        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, encounterId);

            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(read(rs.getString("document")));
                }
            }

        } catch (SQLException e) {
            log.error("Error finding encounter: {}", encounterId, e);
            throw new StorageException("Database error", e);
        }

        return Optional.empty();
    }

    @Override
    public List<Encounter> findByOwner(String ownerId) {
        String sql = "SELECT document FROM encounters WHERE owner_id = ? ORDER BY created_at DESC";
        List<Encounter> encounters = new ArrayList<>();

        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, ownerId);

            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    encounters.add(read(rs.getString("document")));
                }
            }

        } catch (SQLException e) {
            log.error("Error finding encounters for owner: {}", ownerId, e);
            throw new StorageException("Database error", e);
        }

        return encounters;
    }

    @Override
    public Encounter insert(Encounter encounter) {
        String sql = """
                INSERT INTO encounters (id, owner_id, version, document, created_at, updated_at)
                VALUES (?, ?, ?, ?::jsonb, ?, ?)
                """;

        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, encounter.id());
            ps.setString(2, encounter.ownerId());
            ps.setInt(3, encounter.version());
            ps.setString(4, write(encounter));
            ps.setTimestamp(5, Timestamp.from(encounter.createdAt()));
            ps.setTimestamp(6, Timestamp.from(encounter.updatedAt()));

            ps.executeUpdate();
            log.debug("Inserted encounter: {}", encounter.id());
            return encounter;

        } catch (SQLException e) {
            log.error("Error inserting encounter: {}", encounter.id(), e);
            throw new StorageException("Database error", e);
        }
    }

    @Override
    public Encounter update(Encounter encounter) {
        String sql = """
                UPDATE encounters SET document = ?::jsonb, version = ?, updated_at = ?
                WHERE id = ? AND version = ?
                """;

        Instant now = clock.instant();
        Encounter stored = encounter.withStored(encounter.version() + 1, now);

        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, write(stored));
            ps.setInt(2, stored.version());
            ps.setTimestamp(3, Timestamp.from(now));
            ps.setString(4, encounter.id());
            ps.setInt(5, encounter.version());

            int rows = ps.executeUpdate();
            if (rows == 0) {
                throw StorageException.conflict(encounter.id(), encounter.version());
            }
            return stored;

        } catch (SQLException e) {
            log.error("Error updating encounter: {}", encounter.id(), e);
            throw new StorageException("Database error", e);
        }
    }

    @Override
    public boolean delete(String encounterId) {
        String sql = "DELETE FROM encounters WHERE id = ?";

        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, encounterId);
            return ps.executeUpdate() > 0;

        } catch (SQLException e) {
            log.error("Error deleting encounter: {}", encounterId, e);
            throw new StorageException("Database error", e);
        }
    }

    private static String write(Encounter encounter) {
        try {
            return MAPPER.writeValueAsString(encounter);
        } catch (JsonProcessingException e) {
            throw new StorageException("Failed to serialize encounter " + encounter.id(), e);
        }
    }

    private static Encounter read(String document) {
        try {
            return MAPPER.readValue(document, Encounter.class);
        } catch (JsonProcessingException e) {
            throw new StorageException("Corrupt encounter document", e);
        }
    }
}
