package com.adlanda.codeindex.health;

import com.adlanda.codeindex.config.EmbeddingProperties;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Checks that the database carries the index schema: the vector extension,
 * the repos, files and chunks tables, and an embedding column whose
 * dimension matches the configured one.
 */
@Component
@ConditionalOnProperty(name = "codeindex.store.type", havingValue = "postgres", matchIfMissing = true)
public class VectorSchemaHealthIndicator implements HealthIndicator {

    static final List<String> REQUIRED_TABLES = List.of("repos", "files", "chunks");

    static final String EXTENSION_SQL = "SELECT COUNT(*) FROM pg_extension WHERE extname = 'vector'";

    static final String TABLES_SQL = """
            SELECT table_name FROM information_schema.tables
            WHERE table_schema = current_schema()
              AND table_name IN ('repos', 'files', 'chunks')
            """;

    // format_type renders the column as e.g. "vector(384)"
    static final String EMBEDDING_TYPE_SQL = """
            SELECT format_type(a.atttypid, a.atttypmod)
            FROM pg_attribute a
            WHERE a.attrelid = to_regclass('chunks')
              AND a.attname = 'embedding'
              AND NOT a.attisdropped
            """;

    private final JdbcTemplate jdbcTemplate;
    private final EmbeddingProperties embeddingProperties;

    public VectorSchemaHealthIndicator(JdbcTemplate jdbcTemplate, EmbeddingProperties embeddingProperties) {
        this.jdbcTemplate = jdbcTemplate;
        this.embeddingProperties = embeddingProperties;
    }

    @Override
    public Health health() {
        try {
            Integer extensions = jdbcTemplate.queryForObject(EXTENSION_SQL, Integer.class);
            boolean extension = extensions != null && extensions > 0;
            Set<String> tables = new TreeSet<>(jdbcTemplate.queryForList(TABLES_SQL, String.class));
            List<String> types = tables.contains("chunks")
                    ? jdbcTemplate.queryForList(EMBEDDING_TYPE_SQL, String.class)
                    : List.of();

            String expectedType = "vector(" + embeddingProperties.getDimension() + ")";
            String actualType = types.isEmpty() ? "missing" : types.get(0);
            boolean healthy = extension
                    && tables.containsAll(REQUIRED_TABLES)
                    && expectedType.equals(actualType);

            return (healthy ? Health.up() : Health.down())
                    .withDetail("vectorExtension", extension)
                    .withDetail("tables", tables)
                    .withDetail("embeddingColumn", actualType)
                    .withDetail("expectedEmbeddingColumn", expectedType)
                    .build();
        } catch (DataAccessException e) {
            return Health.down(e).build();
        }
    }
}
