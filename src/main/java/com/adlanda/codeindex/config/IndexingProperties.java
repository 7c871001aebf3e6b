package com.adlanda.codeindex.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Configuration properties for repository indexing runs.
 *
 * Maps to properties prefixed with 'codeindex.indexing' in application.properties.
 */
@Component
@Validated
@ConfigurationProperties(prefix = "codeindex.indexing")
public class IndexingProperties {

    /**
     * Blobs larger than this many bytes are skipped as binary-or-large.
     */
    @Min(1)
    private long maxBlobBytes = 512 * 1024;

    /**
     * File extensions (with leading dot) that are never indexed.
     */
    private Set<String> skipExtensions = new LinkedHashSet<>(List.of(
            ".png", ".jpg", ".jpeg", ".gif", ".pdf", ".zip", ".tar", ".gz", ".7z",
            ".exe", ".dll", ".so", ".dylib", ".bin", ".ico", ".svg"));

    @Valid
    private Limits batch = new Limits(1000, 5000);

    @Valid
    private Limits stream = new Limits(50, 1000);

    /**
     * A progress event is emitted every this many chunks written within a file.
     */
    @Min(1)
    private int progressEveryChunks = 50;

    /**
     * Threads available to streaming runs. Each run uses one thread.
     */
    @Min(1)
    private int streamThreads = 4;

    /**
     * How long an SSE connection for a streaming run is kept open.
     */
    @NotNull
    private Duration streamTimeout = Duration.ofMinutes(30);

    @Valid
    private Startup startup = new Startup();

    /**
     * Returns true if the path's lowercased extension is in the skip set.
     */
    public boolean isSkipped(String path) {
        int slash = path.lastIndexOf('/');
        int dot = path.lastIndexOf('.');
        if (dot <= slash + 1) {
            return false;
        }
        String extension = path.substring(dot).toLowerCase(Locale.ROOT);
        return skipExtensions.contains(extension);
    }

    public long getMaxBlobBytes() {
        return maxBlobBytes;
    }

    public void setMaxBlobBytes(long maxBlobBytes) {
        this.maxBlobBytes = maxBlobBytes;
    }

    public Set<String> getSkipExtensions() {
        return skipExtensions;
    }

    public void setSkipExtensions(Set<String> skipExtensions) {
        Set<String> normalized = new LinkedHashSet<>();
        for (String extension : skipExtensions) {
            String trimmed = extension.trim().toLowerCase(Locale.ROOT);
            if (!trimmed.isEmpty()) {
                normalized.add(trimmed.startsWith(".") ? trimmed : "." + trimmed);
            }
        }
        this.skipExtensions = normalized;
    }

    public Limits getBatch() {
        return batch;
    }

    public void setBatch(Limits batch) {
        this.batch = batch;
    }

    public Limits getStream() {
        return stream;
    }

    public void setStream(Limits stream) {
        this.stream = stream;
    }

    public int getProgressEveryChunks() {
        return progressEveryChunks;
    }

    public void setProgressEveryChunks(int progressEveryChunks) {
        this.progressEveryChunks = progressEveryChunks;
    }

    public int getStreamThreads() {
        return streamThreads;
    }

    public void setStreamThreads(int streamThreads) {
        this.streamThreads = streamThreads;
    }

    public Duration getStreamTimeout() {
        return streamTimeout;
    }

    public void setStreamTimeout(Duration streamTimeout) {
        this.streamTimeout = streamTimeout;
    }

    public Startup getStartup() {
        return startup;
    }

    public void setStartup(Startup startup) {
        this.startup = startup;
    }

    /**
     * Default and upper bound for the client-supplied file limit of one run.
     */
    public static class Limits {

        @Min(1)
        private int defaultLimit;

        @Min(1)
        private int maxLimit;

        public Limits() {
        }

        public Limits(int defaultLimit, int maxLimit) {
            this.defaultLimit = defaultLimit;
            this.maxLimit = maxLimit;
        }

        /**
         * Resolves a requested limit, falling back to the default when absent.
         *
         * @throws IllegalArgumentException if the limit is outside [1, maxLimit]
         */
        public int resolve(Integer requested) {
            int limit = requested != null ? requested : defaultLimit;
            if (limit < 1 || limit > maxLimit) {
                throw new IllegalArgumentException(
                        "limit must be between 1 and " + maxLimit + ", got " + limit);
            }
            return limit;
        }

        public int getDefaultLimit() {
            return defaultLimit;
        }

        public void setDefaultLimit(int defaultLimit) {
            this.defaultLimit = defaultLimit;
        }

        public int getMaxLimit() {
            return maxLimit;
        }

        public void setMaxLimit(int maxLimit) {
            this.maxLimit = maxLimit;
        }
    }

    /**
     * Batch runs triggered when the application starts.
     */
    public static class Startup {

        /**
         * Whether repositories are indexed at startup.
         * When false, nothing runs until a client asks for it.
         */
        private boolean enabled = false;

        /**
         * Repositories to index, as owner/name.
         */
        private List<String> repositories = new ArrayList<>();

        /**
         * Caller identity used to look up the GitHub token for startup runs.
         */
        private String user = "default";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public List<String> getRepositories() {
            return repositories;
        }

        public void setRepositories(List<String> repositories) {
            this.repositories = repositories;
        }

        public String getUser() {
            return user;
        }

        public void setUser(String user) {
            this.user = user;
        }
    }
}
