package com.adlanda.codeindex.repository;

import com.adlanda.codeindex.exception.DimensionException;
import com.adlanda.codeindex.model.SearchResult;
import com.adlanda.codeindex.model.StoredChunkIds;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Simple in-memory vector store.
 *
 * Keeps repositories, files and chunks in maps guarded by a single lock, so
 * every operation is atomic. KNN is a linear scan. Used for local runs
 * without PostgreSQL ({@code codeindex.store.type=memory}) and in tests.
 */
public class InMemoryVectorStore implements VectorStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryVectorStore.class);

    private final int dimension;

    private final Map<String, RepoRow> repos = new HashMap<>();
    private final Map<String, FileRow> files = new HashMap<>();
    private final Map<Long, ChunkRow> chunks = new LinkedHashMap<>();

    private long nextRepoId = 1;
    private long nextFileId = 1;
    private long nextChunkId = 1;

    public InMemoryVectorStore(int dimension) {
        if (dimension < 1) {
            throw new IllegalArgumentException("dimension must be positive");
        }
        this.dimension = dimension;
    }

    @Override
    public synchronized long upsertRepository(String owner, String name, String defaultBranch) {
        RepoRow existing = repos.get(repoKey(owner, name));
        if (existing != null) {
            if (defaultBranch != null) {
                existing.defaultBranch = defaultBranch;
            }
            return existing.id;
        }
        RepoRow row = new RepoRow(nextRepoId++, owner, name, defaultBranch);
        repos.put(repoKey(owner, name), row);
        return row.id;
    }

    @Override
    public synchronized long upsertFile(long repoId, String path, String commit, String contentHash) {
        if (repos.values().stream().noneMatch(r -> r.id == repoId)) {
            throw new IllegalArgumentException("unknown repository id " + repoId);
        }
        FileRow existing = files.get(fileKey(repoId, path));
        if (existing != null) {
            if (commit != null) {
                existing.commit = commit;
            }
            if (contentHash != null) {
                existing.contentHash = contentHash;
            }
            return existing.id;
        }
        FileRow row = new FileRow(nextFileId++, repoId, path, commit, contentHash);
        files.put(fileKey(repoId, path), row);
        return row.id;
    }

    /**
     * Appends a chunk. A null embedding stores a stub chunk that KNN ignores.
     */
    @Override
    public synchronized long insertChunk(long fileId, int startLine, int endLine, float[] embedding) {
        if (embedding != null) {
            validate(embedding);
        }
        if (files.values().stream().noneMatch(f -> f.id == fileId)) {
            throw new IllegalArgumentException("unknown file id " + fileId);
        }
        long id = nextChunkId++;
        chunks.put(id, new ChunkRow(id, fileId, startLine, endLine,
                embedding == null ? null : embedding.clone()));
        return id;
    }

    @Override
    public synchronized StoredChunkIds insertChunkWithVector(String owner, String name, String path,
                                                             int startLine, int endLine, float[] embedding) {
        Objects.requireNonNull(embedding, "embedding");
        validate(embedding);
        long repoId = upsertRepository(owner, name, null);
        long fileId = upsertFile(repoId, path, null, null);
        long chunkId = insertChunk(fileId, startLine, endLine, embedding);
        return new StoredChunkIds(repoId, fileId, chunkId);
    }

    @Override
    public synchronized int updateFileMetadata(String owner, String name, String path,
                                               String commit, String contentHash) {
        RepoRow repo = repos.get(repoKey(owner, name));
        if (repo == null) {
            return 0;
        }
        FileRow file = files.get(fileKey(repo.id, path));
        if (file == null) {
            return 0;
        }
        file.commit = commit;
        file.contentHash = contentHash;
        return 1;
    }

    @Override
    public synchronized Set<String> indexedPaths(String owner, String name) {
        RepoRow repo = repos.get(repoKey(owner, name));
        if (repo == null) {
            return Set.of();
        }
        Set<Long> fileIdsWithChunks = new HashSet<>();
        chunks.values().forEach(c -> fileIdsWithChunks.add(c.fileId));

        Set<String> paths = new HashSet<>();
        for (FileRow file : files.values()) {
            if (file.repoId == repo.id && fileIdsWithChunks.contains(file.id)) {
                paths.add(file.path);
            }
        }
        return paths;
    }

    @Override
    public synchronized List<SearchResult> knn(float[] queryVector, int k) {
        Objects.requireNonNull(queryVector, "queryVector");
        validate(queryVector);
        if (k < 1) {
            throw new IllegalArgumentException("k must be >= 1");
        }
        return nearest(queryVector, k);
    }

    @Override
    public synchronized List<SearchResult> knnFromLatest(int k) {
        if (k < 1) {
            throw new IllegalArgumentException("k must be >= 1");
        }
        ChunkRow latest = null;
        for (ChunkRow chunk : chunks.values()) {
            if (chunk.embedding != null && (latest == null || chunk.id > latest.id)) {
                latest = chunk;
            }
        }
        if (latest == null) {
            return List.of();
        }
        return nearest(latest.embedding, k);
    }

    @Override
    public synchronized int purgeRepositoryIndex(String owner, String name) {
        RepoRow repo = repos.get(repoKey(owner, name));
        if (repo == null) {
            return 0;
        }
        Set<Long> repoFileIds = new HashSet<>();
        for (FileRow file : files.values()) {
            if (file.repoId == repo.id) {
                repoFileIds.add(file.id);
                file.commit = null;
                file.contentHash = null;
            }
        }
        int before = chunks.size();
        chunks.values().removeIf(c -> repoFileIds.contains(c.fileId));
        int deleted = before - chunks.size();
        log.info("Purged {} chunks for {}/{}", deleted, owner, name);
        return deleted;
    }

    @Override
    public synchronized long countChunks() {
        return chunks.size();
    }

    @Override
    public int dimension() {
        return dimension;
    }

    /**
     * Returns the stored commit of a file, or null. Exposed for inspection in tests.
     */
    public synchronized String fileCommit(String owner, String name, String path) {
        RepoRow repo = repos.get(repoKey(owner, name));
        FileRow file = repo == null ? null : files.get(fileKey(repo.id, path));
        return file == null ? null : file.commit;
    }

    /**
     * All file paths known for a repository, with or without chunks.
     */
    public synchronized Set<String> knownPaths(String owner, String name) {
        RepoRow repo = repos.get(repoKey(owner, name));
        if (repo == null) {
            return Set.of();
        }
        Set<String> paths = new HashSet<>();
        files.values().stream().filter(f -> f.repoId == repo.id).forEach(f -> paths.add(f.path));
        return paths;
    }

    private List<SearchResult> nearest(float[] query, int k) {
        Map<Long, String> pathsByFileId = new HashMap<>();
        files.values().forEach(f -> pathsByFileId.put(f.id, f.path));

        List<SearchResult> results = new ArrayList<>();
        for (ChunkRow chunk : chunks.values()) {
            if (chunk.embedding == null) {
                continue;
            }
            results.add(new SearchResult(pathsByFileId.get(chunk.fileId), chunk.startLine, chunk.endLine,
                    euclideanDistance(query, chunk.embedding), chunk.id));
        }
        return results.stream()
                .sorted(Comparator.comparingDouble(SearchResult::distance).thenComparingLong(SearchResult::chunkId))
                .limit(k)
                .toList();
    }

    private void validate(float[] vector) {
        if (vector.length != dimension) {
            throw new DimensionException(dimension, vector.length);
        }
    }

    /**
     * Computes the L2 distance between two vectors of equal length.
     */
    static double euclideanDistance(float[] a, float[] b) {
        double sum = 0.0;
        for (int i = 0; i < a.length; i++) {
            double diff = a[i] - b[i];
            sum += diff * diff;
        }
        return Math.sqrt(sum);
    }

    private static String repoKey(String owner, String name) {
        return owner + "/" + name;
    }

    private static String fileKey(long repoId, String path) {
        return repoId + ":" + path;
    }

    private static final class RepoRow {
        final long id;
        final String owner;
        final String name;
        String defaultBranch;

        RepoRow(long id, String owner, String name, String defaultBranch) {
            this.id = id;
            this.owner = owner;
            this.name = name;
            this.defaultBranch = defaultBranch;
        }
    }

    private static final class FileRow {
        final long id;
        final long repoId;
        final String path;
        String commit;
        String contentHash;

        FileRow(long id, long repoId, String path, String commit, String contentHash) {
            this.id = id;
            this.repoId = repoId;
            this.path = path;
            this.commit = commit;
            this.contentHash = contentHash;
        }
    }

    private record ChunkRow(long id, long fileId, int startLine, int endLine, float[] embedding) {}
}
