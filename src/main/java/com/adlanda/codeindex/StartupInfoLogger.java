package com.adlanda.codeindex;

import com.adlanda.codeindex.repository.VectorStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.annotation.Order;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

@Component
@Order(2) // Run after StartupIndexingRunner
public class StartupInfoLogger implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(StartupInfoLogger.class);

    private final VectorStore vectorStore;

    @Value("${server.port:8080}")
    private int port;

    @Value("${info.app.version:0.0.1-SNAPSHOT}")
    private String version;

    @Value("${codeindex.store.type:postgres}")
    private String storeType;

    public StartupInfoLogger(VectorStore vectorStore) {
        this.vectorStore = vectorStore;
    }

    @Override
    public void run(ApplicationArguments args) {
        String chunks;
        try {
            chunks = String.valueOf(vectorStore.countChunks());
        } catch (DataAccessException e) {
            log.warn("Could not count chunks: {}", e.getMessage());
            chunks = "unavailable";
        }

        log.info("""

            Code Vector Index v{}
            Store: {} (dimension {}), {} chunks

            API Endpoints:
              GET    http://localhost:{}/api/v1
              POST   http://localhost:{}/api/v1/repos/{owner}/{name}/index
              GET    http://localhost:{}/api/v1/repos/{owner}/{name}/index/stream
              POST   http://localhost:{}/api/v1/search

            Health:
              GET  http://localhost:{}/actuator/health
            """,
            version, storeType, vectorStore.dimension(), chunks, port, port, port, port, port
        );
    }
}
