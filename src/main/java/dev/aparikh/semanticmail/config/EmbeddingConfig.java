package dev.aparikh.semanticmail.config;

import dev.aparikh.semanticmail.embedding.EmbeddingProvider;
import dev.aparikh.semanticmail.embedding.LangChainEmbeddingProvider;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.openai.OpenAiEmbeddingModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(EmbeddingProperties.class)
class EmbeddingConfig {

    private static final Logger log = LoggerFactory.getLogger(EmbeddingConfig.class);

    @Bean
    EmbeddingModel embeddingModel(EmbeddingProperties embedding) {
        log.info("Using embedding model {} with {} dimensions", embedding.getModelName(), embedding.getDimensions());
        // retries are handled by the sync pipeline
        return OpenAiEmbeddingModel.builder()
                .apiKey(embedding.getApiKey())
                .baseUrl(embedding.getBaseUrl())
                .modelName(embedding.getModelName())
                .dimensions(embedding.getDimensions())
                .timeout(embedding.getTimeout())
                .maxRetries(1)
                .build();
    }

    @Bean
    EmbeddingProvider embeddingProvider(EmbeddingModel model, EmbeddingProperties embedding,
                                        SolrConfigurationProperties solr) {
        if (embedding.getDimensions() != solr.getEmbeddingDimension()) {
            throw new IllegalStateException("embedding.dimensions (" + embedding.getDimensions()
                    + ") must match solr.embedding-dimension (" + solr.getEmbeddingDimension() + ")");
        }
        return new LangChainEmbeddingProvider(model, embedding.getDimensions(), embedding.getMaxBatchSize());
    }
}
