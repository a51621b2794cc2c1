package in.questkeeper.infrastructure.persistence;

import in.questkeeper.application.port.output.StorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Creates the document tables on startup. Idempotent.
 */
public final class SchemaMigration {
    private static final Logger log = LoggerFactory.getLogger(SchemaMigration.class);

    private static final String[] STATEMENTS = {
        """
        CREATE TABLE IF NOT EXISTS encounters (
            id          VARCHAR(64) PRIMARY KEY,
            owner_id    VARCHAR(64) NOT NULL,
            version     INTEGER     NOT NULL,
            document    JSONB       NOT NULL,
            created_at  TIMESTAMPTZ NOT NULL,
            updated_at  TIMESTAMPTZ NOT NULL
        )
        """,
        "CREATE INDEX IF NOT EXISTS idx_encounters_owner ON encounters (owner_id)",
        """
        CREATE TABLE IF NOT EXISTS characters (
            id          VARCHAR(64) PRIMARY KEY,
            owner_id    VARCHAR(64) NOT NULL,
            document    JSONB       NOT NULL,
            created_at  TIMESTAMPTZ NOT NULL
        )
        """,
        """
        CREATE TABLE IF NOT EXISTS encounter_templates (
            template_id VARCHAR(64) PRIMARY KEY,
            owner_id    VARCHAR(64)  NOT NULL,
            name        VARCHAR(100) NOT NULL,
            envelope    JSONB        NOT NULL,
            created_at  TIMESTAMPTZ  NOT NULL
        )
        """,
        "CREATE INDEX IF NOT EXISTS idx_templates_owner ON encounter_templates (owner_id)"
    };

    private final DataSource dataSource;

    public SchemaMigration(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    public void migrate() {
        try (Connection conn = dataSource.getConnection();
                Statement stmt = conn.createStatement()) {
            for (String sql : STATEMENTS) {
                stmt.execute(sql);
            }
            log.info("✓ Schema ready (encounters, characters, encounter_templates)");
        } catch (SQLException e) {
            log.error("Schema migration failed", e);
            throw new StorageException("Database error", e);
        }
    }
}
