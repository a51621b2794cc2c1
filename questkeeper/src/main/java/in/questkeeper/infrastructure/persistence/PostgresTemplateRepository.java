package in.questkeeper.infrastructure.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import in.questkeeper.application.port.output.IdGenerator;
import in.questkeeper.application.port.output.StorageException;
import in.questkeeper.application.port.output.TemplateRepository;
import in.questkeeper.domain.export.ExportEnvelope;
import in.questkeeper.domain.template.EncounterTemplate;
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
 * PostgreSQL implementation of TemplateRepository.
 */
public final class PostgresTemplateRepository implements TemplateRepository {
    private static final Logger log = LoggerFactory.getLogger(PostgresTemplateRepository.class);
    private static final ObjectMapper MAPPER = Json.newMapper();

    private final DataSource dataSource;
    private final IdGenerator ids;
    private final Clock clock;

    public PostgresTemplateRepository(DataSource dataSource, IdGenerator ids, Clock clock) {
        this.dataSource = dataSource;
        this.ids = ids;
        this.clock = clock;
    }

    @Override
    public EncounterTemplate add(String ownerId, String name, ExportEnvelope envelope) {
        String sql = """
                INSERT INTO encounter_templates (template_id, owner_id, name, envelope, created_at)
                VALUES (?, ?, ?, ?::jsonb, ?)
                """;

        EncounterTemplate template = new EncounterTemplate(ids.newId(), ownerId, name, envelope, clock.instant());

        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, template.templateId());
            ps.setString(2, ownerId);
            ps.setString(3, name);
            ps.setString(4, MAPPER.writeValueAsString(envelope));
            ps.setTimestamp(5, Timestamp.from(template.createdAt()));

            ps.executeUpdate();
            log.info("Inserted template: {} ({})", template.templateId(), name);
            return template;

        } catch (SQLException | JsonProcessingException e) {
            log.error("Error inserting template: {}", name, e);
            throw new StorageException("Database error", e);
        }
    }

    @Override
    public Optional<EncounterTemplate> find(String templateId) {
        String sql = """
                SELECT template_id, owner_id, name, envelope, created_at
                FROM encounter_templates WHERE template_id = ?
                """;

        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, templateId);

            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapTemplate(rs));
                }
            }

        } catch (SQLException e) {
            log.error("Error finding template: {}", templateId, e);
            throw new StorageException("Database error", e);
        }

        return Optional.empty();
    }

    @Override
    public List<EncounterTemplate> findByOwner(String ownerId) {
        String sql = """
                SELECT template_id, owner_id, name, envelope, created_at
                FROM encounter_templates WHERE owner_id = ? ORDER BY created_at ASC
                """;
        List<EncounterTemplate> templates = new ArrayList<>();

        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, ownerId);

            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    templates.add(mapTemplate(rs));
                }
            }

        } catch (SQLException e) {
            log.error("Error finding templates for owner: {}", ownerId, e);
            throw new StorageException("Database error", e);
        }

        return templates;
    }

    @Override
    public boolean remove(String templateId) {
        String sql = "DELETE FROM encounter_templates WHERE template_id = ?";

        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, templateId);
            return ps.executeUpdate() > 0;

        } catch (SQLException e) {
            log.error("Error removing template: {}", templateId, e);
            throw new StorageException("Database error", e);
        }
    }

    private EncounterTemplate mapTemplate(ResultSet rs) throws SQLException {
        Instant createdAt = rs.getTimestamp("created_at").toInstant();
        try {
            ExportEnvelope envelope = MAPPER.readValue(rs.getString("envelope"), ExportEnvelope.class);
            return new EncounterTemplate(rs.getString("template_id"), rs.getString("owner_id"),
                rs.getString("name"), envelope, createdAt);
        } catch (JsonProcessingException e) {
            throw new StorageException("Corrupt template envelope", e);
        }
    }
}
