package com.adlanda.codeindex.service;

import com.adlanda.codeindex.config.IndexingProperties;
import com.adlanda.codeindex.credentials.CredentialStore;
import com.adlanda.codeindex.exception.CollaboratorUnavailableException;
import com.adlanda.codeindex.exception.NotConnectedException;
import com.adlanda.codeindex.github.TreeLister;
import com.adlanda.codeindex.health.IndexingHealthIndicator;
import com.adlanda.codeindex.model.CodeChunk;
import com.adlanda.codeindex.model.FileOutcome;
import com.adlanda.codeindex.model.HeadRevision;
import com.adlanda.codeindex.model.IndexingEvent;
import com.adlanda.codeindex.model.IndexingReport;
import com.adlanda.codeindex.model.RepoInfo;
import com.adlanda.codeindex.model.RepositoryRef;
import com.adlanda.codeindex.model.RunSummary;
import com.adlanda.codeindex.model.TreeEntry;
import com.adlanda.codeindex.repository.VectorStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Consumer;

/**
 * Service responsible for indexing a remote repository into the vector store.
 *
 * A run plans the files to index (remote tree minus already indexed and
 * skipped paths, truncated to the limit), then fetches, chunks, embeds and
 * writes them one at a time in tree order. A failing file is reported and
 * the run moves on; only planning failures abort the run.
 *
 * Runs are available in two modes sharing the same steps: {@link #index}
 * blocks and returns a report, {@link #stream} runs on the indexing executor
 * and publishes progress events to a channel.
 */
@Service
public class IndexingService {

    private static final Logger log = LoggerFactory.getLogger(IndexingService.class);

    private final CredentialStore credentialStore;
    private final TreeLister treeLister;
    private final CodeChunker chunker;
    private final EmbeddingService embeddingService;
    private final VectorStore vectorStore;
    private final FileHashService fileHashService;
    private final IndexingProperties properties;
    private final IndexingHealthIndicator healthIndicator;
    private final ExecutorService indexingExecutor;

    private final ConcurrentHashMap<String, Integer> activeRuns = new ConcurrentHashMap<>();

    public IndexingService(CredentialStore credentialStore,
                           TreeLister treeLister,
                           CodeChunker chunker,
                           EmbeddingService embeddingService,
                           VectorStore vectorStore,
                           FileHashService fileHashService,
                           IndexingProperties properties,
                           IndexingHealthIndicator healthIndicator,
                           @Qualifier("indexingExecutor") ExecutorService indexingExecutor) {
        this.credentialStore = credentialStore;
        this.treeLister = treeLister;
        this.chunker = chunker;
        this.embeddingService = embeddingService;
        this.vectorStore = vectorStore;
        this.fileHashService = fileHashService;
        this.properties = properties;
        this.healthIndicator = healthIndicator;
        this.indexingExecutor = indexingExecutor;
    }

    /**
     * Indexes up to {@code limit} not yet indexed files and waits for the run to finish.
     *
     * @param limit Maximum files to index, null for the configured default
     * @throws NotConnectedException if the user has no token
     * @throws IllegalArgumentException if the limit is out of range
     * @throws CollaboratorUnavailableException if planning fails
     */
    public IndexingReport index(String user, RepositoryRef ref, Integer limit) {
        int resolvedLimit = properties.getBatch().resolve(limit);
        String token = requireToken(user);

        List<FileOutcome> outcomes = new ArrayList<>();
        RunResult result = run(token, ref, resolvedLimit, event -> { }, outcomes::add, CancellationSignal.none());
        return new IndexingReport(result.repo(), result.head().branch(), result.head().sha(),
                result.summary(), result.cancelled(), List.copyOf(outcomes));
    }

    /**
     * Starts a run on the indexing executor and returns the channel its events
     * are published to. Closing the channel cancels the run.
     *
     * Token and limit are checked before the run starts; a planning failure
     * is published as a single {@code error} event without a path.
     *
     * @throws NotConnectedException if the user has no token
     * @throws IllegalArgumentException if the limit is out of range
     */
    public IndexingEventChannel stream(String user, RepositoryRef ref, Integer limit) {
        int resolvedLimit = properties.getStream().resolve(limit);
        String token = requireToken(user);

        CancellationSignal cancellation = new CancellationSignal();
        IndexingEventChannel channel = new IndexingEventChannel(cancellation);
        try {
            indexingExecutor.execute(() -> {
                try {
                    run(token, ref, resolvedLimit, channel::publish, outcome -> { }, cancellation);
                } catch (RuntimeException e) {
                    channel.publish(new IndexingEvent.Failure(null, e.getMessage()));
                } catch (Error e) {
                    channel.publish(new IndexingEvent.Failure(null, String.valueOf(e)));
                    throw e;
                }
            });
        } catch (RejectedExecutionException e) {
            throw new IllegalStateException("Indexing executor rejected run for " + ref, e);
        }
        return channel;
    }

    private String requireToken(String user) {
        return credentialStore.tokenFor(user)
                .orElseThrow(() -> new NotConnectedException(user));
    }

    private RunResult run(String token, RepositoryRef ref, int limit,
                          Consumer<IndexingEvent> events,
                          Consumer<FileOutcome> outcomes,
                          CancellationSignal cancellation) {
        String key = ref.toString();
        int active = activeRuns.merge(key, 1, Integer::sum);
        if (active > 1) {
            log.warn("{} indexing runs active for {}; chunks may be duplicated", active, key);
        }
        try {
            Plan plan = plan(token, ref, limit);
            events.accept(new IndexingEvent.Start(plan.repo(), plan.head().branch(), plan.head().sha(),
                    plan.counts()));
            log.info("Indexing {}@{} ({}): {} of {} files, {} already indexed",
                    key, plan.head().branch(), plan.head().sha(),
                    plan.counts().willIndex(), plan.counts().totalCandidates(), plan.counts().alreadyIndexed());

            Counters counters = new Counters();
            boolean cancelled = false;
            for (TreeEntry entry : plan.files()) {
                if (cancellation.isCancelled()) {
                    cancelled = true;
                    break;
                }
                counters.considered++;
                FileOutcome outcome = indexFile(token, plan, entry, counters, events, cancellation);
                if (outcome == null) {
                    cancelled = true;
                    break;
                }
                outcomes.accept(outcome);
                events.accept(IndexingEvent.Progress.of(counters.snapshot()));
            }

            RunSummary summary = counters.snapshot();
            events.accept(new IndexingEvent.Done(plan.repo(), plan.head().branch(), plan.head().sha(),
                    summary, cancelled));
            healthIndicator.markCompleted(key, summary);
            log.info("Indexing {} {}: {} considered, {} files written, {} chunks written, {} errors",
                    key, cancelled ? "cancelled" : "complete", summary.considered(),
                    summary.filesWritten(), summary.chunksWritten(), summary.errors());
            return new RunResult(plan.repo(), plan.head(), summary, cancelled);
        } catch (RuntimeException | Error e) {
            log.error("Indexing {} aborted: {}", key, e.getMessage(), e);
            healthIndicator.markFailed(key, e.getMessage());
            throw e;
        } finally {
            activeRuns.computeIfPresent(key, (k, count) -> count > 1 ? count - 1 : null);
        }
    }

    private Plan plan(String token, RepositoryRef ref, int limit) {
        try {
            RepoInfo repo = treeLister.repositoryInfo(token, ref.owner(), ref.name());
            HeadRevision head = treeLister.resolveHead(token, repo.owner(), repo.name(), repo.defaultBranch());
            List<TreeEntry> entries = treeLister.listBlobs(token, repo.owner(), repo.name(), head.sha());
            Set<String> indexed = vectorStore.indexedPaths(repo.owner(), repo.name());
            vectorStore.upsertRepository(repo.owner(), repo.name(), head.branch());

            List<TreeEntry> candidates = entries.stream()
                    .filter(entry -> !indexed.contains(entry.path()))
                    .filter(entry -> !properties.isSkipped(entry.path()))
                    .limit(limit)
                    .toList();

            IndexingEvent.PlanCounts counts = new IndexingEvent.PlanCounts(
                    entries.size(), indexed.size(), candidates.size(), limit);
            return new Plan(repo, head, candidates, counts);
        } catch (CollaboratorUnavailableException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new CollaboratorUnavailableException("Planning failed for " + ref + ": " + e.getMessage(), e);
        }
    }

    /**
     * Runs one file through fetch, chunk, embed and write.
     *
     * @return The file outcome, or null if the run was cancelled while writing
     */
    private FileOutcome indexFile(String token, Plan plan, TreeEntry entry, Counters counters,
                                  Consumer<IndexingEvent> events, CancellationSignal cancellation) {
        String owner = plan.repo().owner();
        String name = plan.repo().name();
        String path = entry.path();
        long sizeHint = entry.sizeHint();
        events.accept(new IndexingEvent.FileStart(path, sizeHint));

        try {
            String text = treeLister.fetchText(token, owner, name, entry.contentRef(), entry.size());
            if (text == null) {
                events.accept(new IndexingEvent.FileSkip(path, FileOutcome.BINARY_OR_LARGE));
                return FileOutcome.skipped(path, FileOutcome.BINARY_OR_LARGE, sizeHint);
            }

            List<CodeChunk> chunks = chunker.chunk(text);
            if (chunks.isEmpty()) {
                events.accept(new IndexingEvent.FileSkip(path, FileOutcome.NO_CHUNKS));
                return FileOutcome.skipped(path, FileOutcome.NO_CHUNKS, sizeHint);
            }
            events.accept(new IndexingEvent.FileChunked(path, chunks.size(),
                    countLines(text), text.length()));

            List<float[]> vectors = embeddingService.embedAll(chunks.stream().map(CodeChunk::text).toList());
            events.accept(new IndexingEvent.FileEmbedded(path, vectors.size()));

            int every = properties.getProgressEveryChunks();
            for (int i = 0; i < chunks.size(); i++) {
                CodeChunk chunk = chunks.get(i);
                vectorStore.insertChunkWithVector(owner, name, path, chunk.startLine(), chunk.endLine(), vectors.get(i));
                counters.chunksWritten++;
                if (counters.chunksWritten % every == 0) {
                    events.accept(IndexingEvent.Progress.of(counters.snapshot()));
                    if (cancellation.isCancelled()) {
                        log.info("Run cancelled while writing {} ({} of {} chunks)", path, i + 1, chunks.size());
                        return null;
                    }
                }
            }
            counters.filesWritten++;
            updateMetadata(owner, name, path, plan.head().sha(), text);

            events.accept(new IndexingEvent.FileWritten(path, chunks.size()));
            log.debug("Indexed {} ({} chunks)", path, chunks.size());
            return FileOutcome.written(path, chunks.size(), sizeHint);
        } catch (RuntimeException e) {
            counters.errors++;
            log.warn("Failed to index {}/{}:{}: {}", owner, name, path, e.getMessage());
            events.accept(new IndexingEvent.Failure(path, e.getMessage()));
            return FileOutcome.failed(path, e.getMessage(), sizeHint);
        }
    }

    private void updateMetadata(String owner, String name, String path, String head, String text) {
        try {
            vectorStore.updateFileMetadata(owner, name, path, head, fileHashService.computeHash(text));
        } catch (RuntimeException e) {
            log.warn("Could not record commit and hash for {}/{}:{}: {}", owner, name, path, e.getMessage());
        }
    }

    private static int countLines(String text) {
        int lines = 1;
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '\n') {
                lines++;
            }
        }
        return lines;
    }

    private record Plan(RepoInfo repo, HeadRevision head, List<TreeEntry> files,
                        IndexingEvent.PlanCounts counts) {}

    private record RunResult(RepoInfo repo, HeadRevision head, RunSummary summary, boolean cancelled) {}

    private static final class Counters {
        int considered;
        int filesWritten;
        int chunksWritten;
        int errors;

        RunSummary snapshot() {
            return new RunSummary(considered, filesWritten, chunksWritten, errors);
        }
    }
}
