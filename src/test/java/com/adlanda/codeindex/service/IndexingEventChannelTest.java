package com.adlanda.codeindex.service;

import com.adlanda.codeindex.model.IndexingEvent;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class IndexingEventChannelTest {

    @Test
    void publish_deliversEventsInOrder() throws InterruptedException {
        IndexingEventChannel channel = new IndexingEventChannel(new CancellationSignal());

        channel.publish(new IndexingEvent.FileStart("a.java", 10));
        channel.publish(new IndexingEvent.FileSkip("a.java", "binary-or-large"));

        assertThat(channel.poll(1, TimeUnit.SECONDS)).isInstanceOf(IndexingEvent.FileStart.class);
        assertThat(channel.poll(1, TimeUnit.SECONDS)).isInstanceOf(IndexingEvent.FileSkip.class);
        assertThat(channel.poll(10, TimeUnit.MILLISECONDS)).isNull();
    }

    @Test
    void close_cancelsRunAndDropsLaterEvents() throws InterruptedException {
        CancellationSignal cancellation = new CancellationSignal();
        IndexingEventChannel channel = new IndexingEventChannel(cancellation);

        channel.close();

        assertThat(cancellation.isCancelled()).isTrue();
        assertThat(channel.isClosed()).isTrue();
        assertThat(channel.publish(new IndexingEvent.FileStart("a.java", 1))).isFalse();
        assertThat(channel.poll(10, TimeUnit.MILLISECONDS)).isNull();
    }

    @Test
    void terminal_onlyForDoneAndRunLevelErrors() {
        assertThat(new IndexingEvent.Failure("a.java", "boom").terminal()).isFalse();
        assertThat(new IndexingEvent.Failure(null, "boom").terminal()).isTrue();
        assertThat(new IndexingEvent.Progress(1, 1, 1, 0).terminal()).isFalse();
    }
}
