package com.adlanda.codeindex;

import com.adlanda.codeindex.repository.InMemoryVectorStore;
import com.adlanda.codeindex.repository.VectorStore;
import com.adlanda.codeindex.service.EmbeddingModelProvider;
import org.junit.jupiter.api.Test;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;
import org.springframework.test.context.TestPropertySource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

@SpringBootTest
@TestPropertySource(properties = {
    "codeindex.store.type=memory",
    "codeindex.indexing.startup.enabled=false",
    "spring.autoconfigure.exclude="
            + "org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration,"
            + "org.springframework.boot.autoconfigure.jdbc.DataSourceTransactionManagerAutoConfiguration,"
            + "org.springframework.boot.autoconfigure.jdbc.JdbcTemplateAutoConfiguration,"
            + "org.springframework.boot.autoconfigure.sql.init.SqlInitializationAutoConfiguration"
})
class CodeIndexApplicationTests {

    @TestConfiguration
    static class TestConfig {
        @Bean
        @Primary
        public EmbeddingModelProvider testEmbeddingModelProvider() {
            return EmbeddingModelProvider.of(mock(EmbeddingModel.class));
        }
    }

    @Autowired
    private VectorStore vectorStore;

    @Test
    void contextLoads() {
        // Context loads with the in-memory store and no database
        assertThat(vectorStore).isInstanceOf(InMemoryVectorStore.class);
    }
}
