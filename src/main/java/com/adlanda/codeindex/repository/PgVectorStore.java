package com.adlanda.codeindex.repository;

import com.adlanda.codeindex.exception.DimensionException;
import com.adlanda.codeindex.model.SearchResult;
import com.adlanda.codeindex.model.StoredChunkIds;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * PostgreSQL-based vector store using the pgvector extension.
 *
 * Repositories, files and chunks live in the {@code repos}, {@code files} and
 * {@code chunks} tables (see schema.sql). Upserts rely on the unique
 * constraints with ON CONFLICT, vectors are passed as pgvector text literals
 * and nearest neighbors are ordered by the {@code <->} (L2) operator.
 */
public class PgVectorStore implements VectorStore {

    private static final Logger log = LoggerFactory.getLogger(PgVectorStore.class);

    static final String UPSERT_REPOSITORY_SQL = """
            INSERT INTO repos (owner, name, default_branch)
            VALUES (?, ?, ?)
            ON CONFLICT (owner, name) DO UPDATE
            SET default_branch = COALESCE(EXCLUDED.default_branch, repos.default_branch)
            RETURNING id
            """;

    static final String UPSERT_FILE_SQL = """
            INSERT INTO files (repo_id, path, commit_sha, content_hash)
            VALUES (?, ?, ?, ?)
            ON CONFLICT (repo_id, path) DO UPDATE
            SET commit_sha = COALESCE(EXCLUDED.commit_sha, files.commit_sha),
                content_hash = COALESCE(EXCLUDED.content_hash, files.content_hash)
            RETURNING id
            """;

    static final String INSERT_CHUNK_SQL = """
            INSERT INTO chunks (file_id, start_line, end_line, embedding)
            VALUES (?, ?, ?, CAST(? AS vector))
            RETURNING id
            """;

    static final String UPDATE_FILE_METADATA_SQL = """
            UPDATE files f SET commit_sha = ?, content_hash = ?
            FROM repos r
            WHERE f.repo_id = r.id
              AND r.owner = ? AND r.name = ?
              AND f.path = ?
            """;

    static final String INDEXED_PATHS_SQL = """
            SELECT f.path
            FROM files f
            JOIN repos r ON r.id = f.repo_id
            WHERE r.owner = ? AND r.name = ?
              AND EXISTS (SELECT 1 FROM chunks c WHERE c.file_id = f.id)
            """;

    static final String KNN_SQL = """
            SELECT f.path, c.start_line, c.end_line,
                   (c.embedding <-> CAST(? AS vector)) AS distance,
                   c.id AS chunk_id
            FROM chunks c
            JOIN files f ON f.id = c.file_id
            WHERE c.embedding IS NOT NULL
            ORDER BY c.embedding <-> CAST(? AS vector)
            LIMIT ?
            """;

    static final String KNN_FROM_LATEST_SQL = """
            WITH q AS (
                SELECT embedding FROM chunks
                WHERE embedding IS NOT NULL
                ORDER BY id DESC
                LIMIT 1
            )
            SELECT f.path, c.start_line, c.end_line,
                   (c.embedding <-> q.embedding) AS distance,
                   c.id AS chunk_id
            FROM chunks c
            CROSS JOIN q
            JOIN files f ON f.id = c.file_id
            WHERE c.embedding IS NOT NULL
            ORDER BY c.embedding <-> q.embedding
            LIMIT ?
            """;

    static final String PURGE_CHUNKS_SQL = """
            DELETE FROM chunks c
            USING files f, repos r
            WHERE c.file_id = f.id
              AND f.repo_id = r.id
              AND r.owner = ?
              AND r.name = ?
            """;

    static final String CLEAR_FILE_METADATA_SQL = """
            UPDATE files f
            SET commit_sha = NULL, content_hash = NULL
            FROM repos r
            WHERE f.repo_id = r.id
              AND r.owner = ?
              AND r.name = ?
            """;

    static final String COUNT_CHUNKS_SQL = "SELECT COUNT(*) FROM chunks";

    private static final RowMapper<SearchResult> SEARCH_RESULT_MAPPER = (rs, rowNum) -> new SearchResult(
            rs.getString("path"),
            rs.getInt("start_line"),
            rs.getInt("end_line"),
            rs.getDouble("distance"),
            rs.getLong("chunk_id"));

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;
    private final int dimension;

    public PgVectorStore(JdbcTemplate jdbcTemplate, TransactionTemplate transactionTemplate, int dimension) {
        if (dimension < 1) {
            throw new IllegalArgumentException("dimension must be positive");
        }
        this.jdbcTemplate = jdbcTemplate;
        this.transactionTemplate = transactionTemplate;
        this.dimension = dimension;
    }

    @Override
    public long upsertRepository(String owner, String name, String defaultBranch) {
        return queryForId(UPSERT_REPOSITORY_SQL, owner, name, defaultBranch);
    }

    @Override
    public long upsertFile(long repoId, String path, String commit, String contentHash) {
        return queryForId(UPSERT_FILE_SQL, repoId, path, commit, contentHash);
    }

    /**
     * Appends a chunk. A null embedding stores a stub chunk that KNN ignores.
     */
    @Override
    public long insertChunk(long fileId, int startLine, int endLine, float[] embedding) {
        String literal = embedding == null ? null : toVectorLiteral(embedding);
        return queryForId(INSERT_CHUNK_SQL, fileId, startLine, endLine, literal);
    }

    @Override
    public StoredChunkIds insertChunkWithVector(String owner, String name, String path,
                                                int startLine, int endLine, float[] embedding) {
        Objects.requireNonNull(embedding, "embedding");
        String literal = toVectorLiteral(embedding);
        return transactionTemplate.execute(status -> {
            long repoId = queryForId(UPSERT_REPOSITORY_SQL, owner, name, null);
            long fileId = queryForId(UPSERT_FILE_SQL, repoId, path, null, null);
            long chunkId = queryForId(INSERT_CHUNK_SQL, fileId, startLine, endLine, literal);
            log.debug("Stored chunk {} ({}..{}) of {}/{}:{}", chunkId, startLine, endLine, owner, name, path);
            return new StoredChunkIds(repoId, fileId, chunkId);
        });
    }

    @Override
    public int updateFileMetadata(String owner, String name, String path, String commit, String contentHash) {
        return jdbcTemplate.update(UPDATE_FILE_METADATA_SQL, commit, contentHash, owner, name, path);
    }

    @Override
    public Set<String> indexedPaths(String owner, String name) {
        List<String> paths = jdbcTemplate.queryForList(INDEXED_PATHS_SQL, String.class, owner, name);
        return new HashSet<>(paths);
    }

    @Override
    public List<SearchResult> knn(float[] queryVector, int k) {
        Objects.requireNonNull(queryVector, "queryVector");
        String literal = toVectorLiteral(queryVector);
        if (k < 1) {
            throw new IllegalArgumentException("k must be >= 1");
        }
        return jdbcTemplate.query(KNN_SQL, SEARCH_RESULT_MAPPER, literal, literal, k);
    }

    @Override
    public List<SearchResult> knnFromLatest(int k) {
        if (k < 1) {
            throw new IllegalArgumentException("k must be >= 1");
        }
        return jdbcTemplate.query(KNN_FROM_LATEST_SQL, SEARCH_RESULT_MAPPER, k);
    }

    @Override
    public int purgeRepositoryIndex(String owner, String name) {
        Integer deleted = transactionTemplate.execute(status -> {
            int count = jdbcTemplate.update(PURGE_CHUNKS_SQL, owner, name);
            jdbcTemplate.update(CLEAR_FILE_METADATA_SQL, owner, name);
            return count;
        });
        int result = deleted != null ? deleted : 0;
        log.info("Purged {} chunks for {}/{}", result, owner, name);
        return result;
    }

    @Override
    public long countChunks() {
        Long count = jdbcTemplate.queryForObject(COUNT_CHUNKS_SQL, Long.class);
        return count != null ? count : 0L;
    }

    @Override
    public int dimension() {
        return dimension;
    }

    /**
     * Formats a vector as a pgvector literal, e.g. {@code [0.1,0.2,0.3]}.
     *
     * @throws DimensionException if the length differs from the configured dimension
     */
    String toVectorLiteral(float[] vector) {
        if (vector.length != dimension) {
            throw new DimensionException(dimension, vector.length);
        }
        StringBuilder sb = new StringBuilder(vector.length * 10 + 2);
        sb.append('[');
        for (int i = 0; i < vector.length; i++) {
            float value = vector[i];
            if (!Float.isFinite(value)) {
                throw new IllegalArgumentException("vector contains a non-finite value at index " + i);
            }
            if (i > 0) {
                sb.append(',');
            }
            sb.append(value);
        }
        return sb.append(']').toString();
    }

    private long queryForId(String sql, Object... args) {
        Long id = jdbcTemplate.queryForObject(sql, Long.class, args);
        if (id == null) {
            throw new IllegalStateException("Statement returned no id: " + sql.lines().findFirst().orElse(sql));
        }
        return id;
    }
}
