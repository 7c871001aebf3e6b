package com.adlanda.codeindex.controller;

import com.adlanda.codeindex.config.IndexingProperties;
import com.adlanda.codeindex.model.FilesSummary;
import com.adlanda.codeindex.model.IndexingEvent;
import com.adlanda.codeindex.model.IndexingReport;
import com.adlanda.codeindex.model.PurgeResult;
import com.adlanda.codeindex.model.RepositoryFiles;
import com.adlanda.codeindex.model.RepositoryRef;
import com.adlanda.codeindex.service.IndexingEventChannel;
import com.adlanda.codeindex.service.IndexingService;
import com.adlanda.codeindex.service.RepositoryIndexService;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;

/**
 * REST controller for indexing repositories and inspecting their index state.
 *
 * The caller is identified by the optional X-User header.
 */
@RestController
@RequestMapping("/api/v1/repos/{owner}/{name}")
public class IndexController {

    private static final Logger log = LoggerFactory.getLogger(IndexController.class);

    static final String USER_HEADER = "X-User";
    static final String DEFAULT_USER = "default";

    private final IndexingService indexingService;
    private final RepositoryIndexService repositoryIndexService;
    private final IndexingProperties properties;
    private final ObjectMapper objectMapper;
    private final Executor sseExecutor;

    public IndexController(IndexingService indexingService,
                           RepositoryIndexService repositoryIndexService,
                           IndexingProperties properties,
                           ObjectMapper objectMapper,
                           @Qualifier("sseExecutor") Executor sseExecutor) {
        this.indexingService = indexingService;
        this.repositoryIndexService = repositoryIndexService;
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.sseExecutor = sseExecutor;
    }

    /**
     * Indexes up to {@code limit} files not yet indexed and returns the run report.
     */
    @PostMapping("/index")
    public ResponseEntity<IndexingReport> index(@PathVariable String owner,
                                                @PathVariable String name,
                                                @RequestParam(required = false) Integer limit,
                                                @RequestHeader(value = USER_HEADER, defaultValue = DEFAULT_USER) String user) {
        return ResponseEntity.ok(indexingService.index(user, new RepositoryRef(owner, name), limit));
    }

    /**
     * Indexes like {@link #index} and streams progress as server-sent events.
     * Disconnecting cancels the run.
     */
    @GetMapping(value = "/index/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter streamIndex(@PathVariable String owner,
                                  @PathVariable String name,
                                  @RequestParam(required = false) Integer limit,
                                  @RequestHeader(value = USER_HEADER, defaultValue = DEFAULT_USER) String user) {
        RepositoryRef ref = new RepositoryRef(owner, name);
        IndexingEventChannel channel = indexingService.stream(user, ref, limit);

        SseEmitter emitter = new SseEmitter(properties.getStreamTimeout().toMillis());
        emitter.onCompletion(channel::close);
        emitter.onTimeout(() -> {
            log.warn("Indexing stream for {} timed out", ref);
            channel.close();
        });
        emitter.onError(error -> {
            log.debug("Indexing stream for {} failed: {}", ref, error.getMessage());
            channel.close();
        });

        sseExecutor.execute(() -> forward(ref, channel, emitter));
        return emitter;
    }

    @DeleteMapping("/index")
    public ResponseEntity<PurgeResult> purge(@PathVariable String owner, @PathVariable String name) {
        return ResponseEntity.ok(repositoryIndexService.purge(new RepositoryRef(owner, name)));
    }

    @GetMapping("/files")
    public ResponseEntity<RepositoryFiles> files(@PathVariable String owner,
                                                 @PathVariable String name,
                                                 @RequestHeader(value = USER_HEADER, defaultValue = DEFAULT_USER) String user) {
        return ResponseEntity.ok(repositoryIndexService.listFiles(user, new RepositoryRef(owner, name)));
    }

    @GetMapping("/files/summary")
    public ResponseEntity<FilesSummary> filesSummary(@PathVariable String owner,
                                                     @PathVariable String name,
                                                     @RequestHeader(value = USER_HEADER, defaultValue = DEFAULT_USER) String user) {
        return ResponseEntity.ok(repositoryIndexService.summarize(user, new RepositoryRef(owner, name)));
    }

    private void forward(RepositoryRef ref, IndexingEventChannel channel, SseEmitter emitter) {
        try {
            while (!channel.isClosed()) {
                IndexingEvent event = channel.poll(1, TimeUnit.SECONDS);
                if (event == null) {
                    continue;
                }
                emitter.send(SseEmitter.event()
                        .name(event.eventName())
                        .data(objectMapper.writeValueAsString(event)));
                if (event.terminal()) {
                    emitter.complete();
                    return;
                }
            }
        } catch (IOException e) {
            log.info("Client left indexing stream for {}, cancelling run", ref);
            channel.close();
            emitter.completeWithError(e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            channel.close();
            emitter.complete();
        }
    }
}
