package com.adlanda.codeindex.repository;

import com.adlanda.codeindex.exception.DimensionException;
import com.adlanda.codeindex.model.SearchResult;
import com.adlanda.codeindex.model.StoredChunkIds;

import java.util.List;
import java.util.Set;

/**
 * Storage for repositories, files and embedded chunks.
 *
 * The store assigns every identifier and enforces uniqueness of
 * (owner, name) for repositories and (repository, path) for files.
 * Writes touching more than one entity are atomic.
 */
public interface VectorStore {

    /**
     * Inserts the repository or, if (owner, name) exists, merges the default branch.
     * A null branch keeps the stored one.
     *
     * @return The repository id, stable across calls
     */
    long upsertRepository(String owner, String name, String defaultBranch);

    /**
     * Inserts the file or, if (repoId, path) exists, merges commit and content hash.
     * Null values keep the stored ones.
     *
     * @return The file id
     */
    long upsertFile(long repoId, String path, String commit, String contentHash);

    /**
     * Appends a chunk to a file.
     *
     * @throws DimensionException if the embedding length differs from the configured dimension
     */
    long insertChunk(long fileId, int startLine, int endLine, float[] embedding);

    /**
     * Upserts repository and file and appends the chunk, all in one transaction.
     * The embedding is validated before anything is written.
     *
     * @throws DimensionException if the embedding length differs from the configured dimension
     */
    StoredChunkIds insertChunkWithVector(String owner, String name, String path,
                                         int startLine, int endLine, float[] embedding);

    /**
     * Records the revision and content hash a file was indexed from.
     *
     * @return Number of file rows updated (0 or 1)
     */
    int updateFileMetadata(String owner, String name, String path, String commit, String contentHash);

    /**
     * Paths of the repository that have at least one chunk.
     */
    Set<String> indexedPaths(String owner, String name);

    /**
     * The k chunks nearest to the query under L2 distance, closest first.
     * Chunks without an embedding are never returned.
     *
     * @throws DimensionException if the query length differs from the configured dimension
     */
    List<SearchResult> knn(float[] queryVector, int k);

    /**
     * KNN using the most recently inserted non-null embedding as the query.
     *
     * @return Empty when no chunk has an embedding
     */
    List<SearchResult> knnFromLatest(int k);

    /**
     * Deletes every chunk of the repository and clears commit and content hash
     * of its files. Repository and file rows are kept.
     *
     * @return Number of chunks deleted
     */
    int purgeRepositoryIndex(String owner, String name);

    /**
     * Total number of stored chunks.
     */
    long countChunks();

    /**
     * The vector length this store accepts.
     */
    int dimension();
}
