package com.adlanda.codeindex.repository;

import com.adlanda.codeindex.exception.DimensionException;
import com.adlanda.codeindex.model.SearchResult;
import com.adlanda.codeindex.model.StoredChunkIds;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class InMemoryVectorStoreTest {

    private InMemoryVectorStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryVectorStore(3);
    }

    @Test
    void upsertRepository_sameOwnerAndName_returnsSameIdAndKeepsBranch() {
        long first = store.upsertRepository("acme", "api", "main");
        long second = store.upsertRepository("acme", "api", null);

        assertThat(second).isEqualTo(first);
        assertThat(store.upsertRepository("acme", "web", null)).isNotEqualTo(first);
    }

    @Test
    void upsertFile_existingPath_mergesMetadata() {
        long repoId = store.upsertRepository("acme", "api", "main");
        long fileId = store.upsertFile(repoId, "src/App.java", "abc123", null);

        assertThat(store.upsertFile(repoId, "src/App.java", null, "hash")).isEqualTo(fileId);
        assertThat(store.fileCommit("acme", "api", "src/App.java")).isEqualTo("abc123");
    }

    @Test
    void insertChunkWithVector_createsRepositoryAndFile() {
        StoredChunkIds ids = store.insertChunkWithVector("acme", "api", "src/App.java", 1, 10, new float[]{1, 0, 0});
        StoredChunkIds next = store.insertChunkWithVector("acme", "api", "src/App.java", 8, 20, new float[]{0, 1, 0});

        assertThat(next.repoId()).isEqualTo(ids.repoId());
        assertThat(next.fileId()).isEqualTo(ids.fileId());
        assertThat(next.chunkId()).isGreaterThan(ids.chunkId());
        assertThat(store.indexedPaths("acme", "api")).containsExactly("src/App.java");
        assertThat(store.countChunks()).isEqualTo(2);
    }

    @Test
    void insertChunkWithVector_wrongDimension_writesNothing() {
        assertThatThrownBy(() -> store.insertChunkWithVector("acme", "api", "a.java", 1, 1, new float[]{1, 2}))
                .isInstanceOf(DimensionException.class)
                .hasMessage("vector must be length 3, got 2");

        assertThat(store.knownPaths("acme", "api")).isEmpty();
        assertThat(store.countChunks()).isZero();
    }

    @Test
    void indexedPaths_fileWithoutChunks_isNotIndexed() {
        long repoId = store.upsertRepository("acme", "api", "main");
        store.upsertFile(repoId, "README.md", null, null);

        assertThat(store.indexedPaths("acme", "api")).isEmpty();
        assertThat(store.indexedPaths("acme", "unknown")).isEmpty();
    }

    @Test
    void knn_returnsClosestFirstAndSkipsStubChunks() {
        store.insertChunkWithVector("acme", "api", "far.java", 1, 5, new float[]{10, 0, 0});
        store.insertChunkWithVector("acme", "api", "near.java", 1, 5, new float[]{1, 0, 0});
        long fileId = store.insertChunkWithVector("acme", "api", "stub.java", 1, 1, new float[]{0, 0, 0}).fileId();
        store.insertChunk(fileId, 2, 2, null);

        List<SearchResult> results = store.knn(new float[]{1, 0, 0}, 10);

        assertThat(results).hasSize(3);
        assertThat(results.get(0).path()).isEqualTo("near.java");
        assertThat(results.get(0).distance()).isCloseTo(0.0, within(1e-9));
        assertThat(results.get(1).path()).isEqualTo("stub.java");
        assertThat(results.get(2).path()).isEqualTo("far.java");
        assertThat(results.get(2).distance()).isCloseTo(9.0, within(1e-6));
    }

    @Test
    void knn_limitsToK() {
        for (int i = 0; i < 5; i++) {
            store.insertChunkWithVector("acme", "api", "f" + i + ".java", 1, 1, new float[]{i, 0, 0});
        }

        assertThat(store.knn(new float[]{0, 0, 0}, 2))
                .extracting(SearchResult::path)
                .containsExactly("f0.java", "f1.java");
    }

    @Test
    void knn_invalidInput_throws() {
        assertThatThrownBy(() -> store.knn(new float[]{1, 2, 3, 4}, 1))
                .isInstanceOf(DimensionException.class);
        assertThatThrownBy(() -> store.knn(new float[]{1, 2, 3}, 0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void knnFromLatest_usesMostRecentEmbedding() {
        assertThat(store.knnFromLatest(3)).isEmpty();

        store.insertChunkWithVector("acme", "api", "old.java", 1, 1, new float[]{5, 5, 5});
        store.insertChunkWithVector("acme", "api", "new.java", 1, 1, new float[]{0, 0, 1});

        List<SearchResult> results = store.knnFromLatest(1);

        assertThat(results).singleElement().satisfies(result -> {
            assertThat(result.path()).isEqualTo("new.java");
            assertThat(result.distance()).isZero();
        });
    }

    @Test
    void purgeRepositoryIndex_deletesChunksAndClearsMetadataOnly() {
        store.insertChunkWithVector("acme", "api", "a.java", 1, 1, new float[]{1, 0, 0});
        store.insertChunkWithVector("acme", "api", "a.java", 2, 2, new float[]{1, 0, 0});
        store.updateFileMetadata("acme", "api", "a.java", "abc123", "hash");
        store.insertChunkWithVector("acme", "web", "b.java", 1, 1, new float[]{1, 0, 0});

        int deleted = store.purgeRepositoryIndex("acme", "api");

        assertThat(deleted).isEqualTo(2);
        assertThat(store.indexedPaths("acme", "api")).isEmpty();
        assertThat(store.knownPaths("acme", "api")).containsExactly("a.java");
        assertThat(store.fileCommit("acme", "api", "a.java")).isNull();
        assertThat(store.indexedPaths("acme", "web")).containsExactly("b.java");
        assertThat(store.purgeRepositoryIndex("nobody", "nothing")).isZero();
    }

    @Test
    void updateFileMetadata_unknownFile_updatesNothing() {
        assertThat(store.updateFileMetadata("acme", "api", "missing.java", "abc", "hash")).isZero();
    }
}
