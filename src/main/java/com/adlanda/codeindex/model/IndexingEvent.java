package com.adlanda.codeindex.model;

/**
 * One progress record emitted by a streaming indexing run.
 *
 * Every event is self-contained; {@link #eventName()} is the wire name used as
 * the SSE event type, the record components are the JSON payload.
 */
public interface IndexingEvent {

    String eventName();

    /**
     * True for the event that ends a run ({@code done} or a run-level {@code error}).
     */
    default boolean terminal() {
        return false;
    }

    record Start(RepoInfo repo, String branch, String head, PlanCounts counts) implements IndexingEvent {
        @Override
        public String eventName() {
            return "start";
        }
    }

    record PlanCounts(int totalCandidates, int alreadyIndexed, int willIndex, int limit) {}

    record FileStart(String path, long sizeHint) implements IndexingEvent {
        @Override
        public String eventName() {
            return "file-start";
        }
    }

    record FileSkip(String path, String reason) implements IndexingEvent {
        @Override
        public String eventName() {
            return "file-skip";
        }
    }

    record FileChunked(String path, int chunks, int totalLines, int totalChars) implements IndexingEvent {
        @Override
        public String eventName() {
            return "file-chunked";
        }
    }

    record FileEmbedded(String path, int embedCount) implements IndexingEvent {
        @Override
        public String eventName() {
            return "file-embedded";
        }
    }

    record FileWritten(String path, int chunksWritten) implements IndexingEvent {
        @Override
        public String eventName() {
            return "file-written";
        }
    }

    record Progress(int considered, int filesWritten, int chunksWritten, int errors) implements IndexingEvent {
        @Override
        public String eventName() {
            return "progress";
        }

        public static Progress of(RunSummary summary) {
            return new Progress(summary.considered(), summary.filesWritten(),
                    summary.chunksWritten(), summary.errors());
        }
    }

    /**
     * A failure. With a path it concerns one file and the run continues;
     * without one the run was aborted and this is the last event.
     */
    record Failure(String path, String message) implements IndexingEvent {
        @Override
        public String eventName() {
            return "error";
        }

        @Override
        public boolean terminal() {
            return path == null;
        }
    }

    record Done(RepoInfo repo, String branch, String head, RunSummary counts, boolean cancelled)
            implements IndexingEvent {
        @Override
        public String eventName() {
            return "done";
        }

        @Override
        public boolean terminal() {
            return true;
        }
    }
}
