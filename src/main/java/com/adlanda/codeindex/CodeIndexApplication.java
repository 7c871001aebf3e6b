package com.adlanda.codeindex;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Code Vector Index - Main Application
 *
 * Pulls source files from GitHub repositories, splits them into overlapping
 * line-ranged chunks, embeds every chunk and serves nearest-neighbor lookups
 * over the stored vectors.
 *
 * This application uses:
 * - Spring Boot 3.4 on Java 17
 * - Spring AI's EmbeddingModel abstraction (local ONNX transformers model by default)
 * - PostgreSQL with the pgvector extension for vector storage and L2 search
 *
 * @see <a href="https://docs.spring.io/spring-ai/reference/">Spring AI Documentation</a>
 */
@SpringBootApplication
public class CodeIndexApplication {

    public static void main(String[] args) {
        SpringApplication.run(CodeIndexApplication.class, args);
    }
}
