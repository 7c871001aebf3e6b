package com.adlanda.codeindex.health;

import com.adlanda.codeindex.model.RunSummary;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import static org.assertj.core.api.Assertions.assertThat;

class IndexingHealthIndicatorTest {

    private IndexingHealthIndicator indicator;

    @BeforeEach
    void setUp() {
        indicator = new IndexingHealthIndicator();
    }

    @Test
    void health_beforeAnyRun_isUpWithNeverRun() {
        Health health = indicator.health();

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails()).containsEntry("lastRun", "never");
    }

    @Test
    void health_afterCompletedRun_reportsCounts() {
        indicator.markCompleted("acme/api", new RunSummary(10, 7, 120, 2));

        Health health = indicator.health();

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails())
                .containsEntry("repository", "acme/api")
                .containsEntry("filesWritten", 7)
                .containsEntry("chunksWritten", 120)
                .containsEntry("errors", 2);
    }

    @Test
    void health_afterFailedRun_isDown() {
        indicator.markFailed("acme/api", "GitHub returned 502");

        Health health = indicator.health();

        assertThat(health.getStatus()).isEqualTo(Status.DOWN);
        assertThat(health.getDetails()).containsEntry("error", "GitHub returned 502");
    }

    @Test
    void health_failureThenSuccess_recovers() {
        indicator.markFailed("acme/api", "boom");
        indicator.markCompleted("acme/api", new RunSummary(1, 1, 1, 0));

        assertThat(indicator.health().getStatus()).isEqualTo(Status.UP);
    }
}
