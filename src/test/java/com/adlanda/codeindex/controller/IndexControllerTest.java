package com.adlanda.codeindex.controller;

import com.adlanda.codeindex.config.IndexingProperties;
import com.adlanda.codeindex.exception.CollaboratorUnavailableException;
import com.adlanda.codeindex.exception.NotConnectedException;
import com.adlanda.codeindex.model.FileOutcome;
import com.adlanda.codeindex.model.FileStatus;
import com.adlanda.codeindex.model.FilesSummary;
import com.adlanda.codeindex.model.IndexingEvent;
import com.adlanda.codeindex.model.IndexingReport;
import com.adlanda.codeindex.model.PurgeResult;
import com.adlanda.codeindex.model.RepoInfo;
import com.adlanda.codeindex.model.RepositoryFiles;
import com.adlanda.codeindex.model.RepositoryRef;
import com.adlanda.codeindex.model.RunSummary;
import com.adlanda.codeindex.service.CancellationSignal;
import com.adlanda.codeindex.service.IndexingEventChannel;
import com.adlanda.codeindex.service.IndexingService;
import com.adlanda.codeindex.service.RepositoryIndexService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(IndexController.class)
@Import(IndexControllerTest.TestConfig.class)
class IndexControllerTest {

    private static final RepositoryRef REF = new RepositoryRef("acme", "api");
    private static final RepoInfo REPO = new RepoInfo("acme", "api", "main");

    @TestConfiguration
    static class TestConfig {
        @Bean
        public IndexingProperties indexingProperties() {
            return new IndexingProperties();
        }

        @Bean(destroyMethod = "shutdownNow")
        public ExecutorService sseExecutor() {
            return Executors.newCachedThreadPool();
        }
    }

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private IndexingService indexingService;

    @MockBean
    private RepositoryIndexService repositoryIndexService;

    @Test
    void index_returnsReport() throws Exception {
        IndexingReport report = new IndexingReport(REPO, "main", "abc123", new RunSummary(2, 1, 3, 0), false,
                List.of(FileOutcome.written("src/App.java", 3, 120),
                        FileOutcome.skipped("logo.dat", FileOutcome.BINARY_OR_LARGE, 4096)));
        when(indexingService.index("alice", REF, 10)).thenReturn(report);

        mockMvc.perform(post("/api/v1/repos/acme/api/index")
                        .param("limit", "10")
                        .header("X-User", "alice"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.repo.owner").value("acme"))
                .andExpect(jsonPath("$.head").value("abc123"))
                .andExpect(jsonPath("$.counts.files_written").value(1))
                .andExpect(jsonPath("$.counts.chunks_written").value(3))
                .andExpect(jsonPath("$.results[0].status").value("WRITTEN"))
                .andExpect(jsonPath("$.results[1].reason").value("binary-or-large"));
    }

    @Test
    void index_noCredential_returnsUnauthorized() throws Exception {
        when(indexingService.index("default", REF, null)).thenThrow(new NotConnectedException("default"));

        mockMvc.perform(post("/api/v1/repos/acme/api/index"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.status").value("error"));
    }

    @Test
    void index_limitOutOfRange_returnsBadRequest() throws Exception {
        when(indexingService.index("default", REF, 9999))
                .thenThrow(new IllegalArgumentException("limit must be between 1 and 5000, got 9999"));

        mockMvc.perform(post("/api/v1/repos/acme/api/index").param("limit", "9999"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("limit must be between 1 and 5000, got 9999"));
    }

    @Test
    void index_hostUnavailable_returnsBadGateway() throws Exception {
        when(indexingService.index("default", REF, null))
                .thenThrow(new CollaboratorUnavailableException("GitHub returned 503", 503, null));

        mockMvc.perform(post("/api/v1/repos/acme/api/index"))
                .andExpect(status().isBadGateway());
    }

    @Test
    void streamIndex_forwardsEventsAsServerSentEvents() throws Exception {
        IndexingEventChannel channel = new IndexingEventChannel(new CancellationSignal());
        channel.publish(new IndexingEvent.FileStart("src/App.java", 120));
        channel.publish(new IndexingEvent.FileWritten("src/App.java", 3));
        channel.publish(new IndexingEvent.Done(REPO, "main", "abc123", new RunSummary(1, 1, 3, 0), false));
        when(indexingService.stream("default", REF, 5)).thenReturn(channel);

        MvcResult result = mockMvc.perform(get("/api/v1/repos/acme/api/index/stream").param("limit", "5"))
                .andExpect(request().asyncStarted())
                .andReturn();
        result.getAsyncResult(5_000);

        String body = result.getResponse().getContentAsString();
        assertThat(body)
                .contains("event:file-start")
                .contains("\"path\":\"src/App.java\"")
                .contains("\"size_hint\":120")
                .contains("event:file-written")
                .contains("event:done")
                .contains("\"files_written\":1");
        assertThat(body.indexOf("event:file-start")).isLessThan(body.indexOf("event:done"));
    }

    @Test
    void purge_returnsDeletedChunks() throws Exception {
        when(repositoryIndexService.purge(REF)).thenReturn(new PurgeResult("acme", "api", 17));

        mockMvc.perform(delete("/api/v1/repos/acme/api/index"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.deleted_chunks").value(17));
    }

    @Test
    void files_returnsStatusLabels() throws Exception {
        when(repositoryIndexService.listFiles("default", REF)).thenReturn(new RepositoryFiles(REPO, List.of(
                new FileStatus("a.java", FileStatus.Status.INDEXED),
                new FileStatus("b.java", FileStatus.Status.NOT_INDEXED))));

        mockMvc.perform(get("/api/v1/repos/acme/api/files"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.files[0].status").value("indexed"))
                .andExpect(jsonPath("$.files[1].status").value("not-indexed"));
    }

    @Test
    void filesSummary_returnsCounts() throws Exception {
        when(repositoryIndexService.summarize("default", REF)).thenReturn(new FilesSummary(REPO, 12, 5));

        mockMvc.perform(get("/api/v1/repos/acme/api/files/summary"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.total").value(12))
                .andExpect(jsonPath("$.indexed").value(5));
    }
}
