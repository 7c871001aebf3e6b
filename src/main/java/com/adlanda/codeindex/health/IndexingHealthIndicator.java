package com.adlanda.codeindex.health;

import com.adlanda.codeindex.model.RunSummary;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Health indicator for repository indexing.
 *
 * Reports the outcome of the last indexing run:
 * - Which repository was indexed and when
 * - Files and chunks written, and per-file errors
 * - The failure message if the run aborted
 *
 * Before any run the indicator is UP with lastRun "never"; a service
 * that has not indexed anything yet is still able to serve queries.
 */
@Component
public class IndexingHealthIndicator implements HealthIndicator {

    private final AtomicReference<HealthState> state = new AtomicReference<>(
            new HealthState(true, null, null, null, null)
    );

    /**
     * Records a run that reached its end, cancelled or not.
     */
    public void markCompleted(String repository, RunSummary summary) {
        state.set(new HealthState(true, repository, summary, null, Instant.now()));
    }

    /**
     * Records a run that aborted before or during planning.
     */
    public void markFailed(String repository, String error) {
        state.set(new HealthState(false, repository, null, error, Instant.now()));
    }

    @Override
    public Health health() {
        HealthState current = state.get();
        String lastRun = current.timestamp() != null ? current.timestamp().toString() : "never";

        if (current.healthy()) {
            Health.Builder builder = Health.up().withDetail("lastRun", lastRun);
            if (current.repository() != null) {
                builder.withDetail("repository", current.repository());
            }
            if (current.summary() != null) {
                builder.withDetail("filesConsidered", current.summary().considered())
                       .withDetail("filesWritten", current.summary().filesWritten())
                       .withDetail("chunksWritten", current.summary().chunksWritten())
                       .withDetail("errors", current.summary().errors());
            }
            return builder.build();
        }

        return Health.down()
                .withDetail("repository", String.valueOf(current.repository()))
                .withDetail("error", String.valueOf(current.error()))
                .withDetail("lastAttempt", lastRun)
                .build();
    }

    private record HealthState(
            boolean healthy,
            String repository,
            RunSummary summary,
            String error,
            Instant timestamp
    ) {}
}
