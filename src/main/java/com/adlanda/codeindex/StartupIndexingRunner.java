package com.adlanda.codeindex;

import com.adlanda.codeindex.config.IndexingProperties;
import com.adlanda.codeindex.model.IndexingReport;
import com.adlanda.codeindex.model.RepositoryRef;
import com.adlanda.codeindex.service.IndexingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Indexes the configured repositories on application startup.
 *
 * Enabled with codeindex.indexing.startup.enabled. Each entry of
 * codeindex.indexing.startup.repositories is an owner/name pair; a failing
 * repository is logged and the next one is indexed.
 */
@Component
@Order(1) // Run before StartupInfoLogger
public class StartupIndexingRunner implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(StartupIndexingRunner.class);

    private final IndexingService indexingService;
    private final IndexingProperties properties;

    public StartupIndexingRunner(IndexingService indexingService, IndexingProperties properties) {
        this.indexingService = indexingService;
        this.properties = properties;
    }

    @Override
    public void run(ApplicationArguments args) {
        IndexingProperties.Startup startup = properties.getStartup();
        if (!startup.isEnabled() || startup.getRepositories().isEmpty()) {
            log.debug("Startup indexing disabled");
            return;
        }

        log.info("Starting startup indexing of {} repositories...", startup.getRepositories().size());
        for (String repository : startup.getRepositories()) {
            try {
                RepositoryRef ref = RepositoryRef.parse(repository);
                IndexingReport report = indexingService.index(startup.getUser(), ref, null);
                log.info("Startup indexing of {} complete: {} files written, {} chunks written, {} errors",
                        ref, report.counts().filesWritten(), report.counts().chunksWritten(),
                        report.counts().errors());
            } catch (Exception e) {
                log.error("Failed to index {} on startup: {}", repository, e.getMessage(), e);
            }
        }
    }
}
