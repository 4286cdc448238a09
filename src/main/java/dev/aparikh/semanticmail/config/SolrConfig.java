package dev.aparikh.semanticmail.config;

import dev.aparikh.semanticmail.indexing.SolrSchemaInstaller;
import org.apache.solr.client.solrj.SolrClient;
import org.apache.solr.client.solrj.impl.HttpSolrClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(SolrConfigurationProperties.class)
class SolrConfig {

    private static final Logger log = LoggerFactory.getLogger(SolrConfig.class);

    private final SolrConfigurationProperties properties;

    SolrConfig(SolrConfigurationProperties properties) {
        this.properties = properties;
    }

    @Bean
    SolrClient solrClient() {
        // Cores are addressed per request, so the client points at the Solr root
        String baseUrl = properties.getBaseUrl();
        if (baseUrl.endsWith("/")) {
            baseUrl = baseUrl.substring(0, baseUrl.length() - 1);
        }
        return new HttpSolrClient.Builder(baseUrl).build();
    }

    @Bean
    @ConditionalOnProperty(prefix = "solr", name = "install-schema", havingValue = "true")
    ApplicationRunner solrSchemaRunner(SolrClient solrClient) {
        return args -> {
            log.info("Installing Solr schema into cores {} and {}",
                    properties.getEmailsCore(), properties.getCursorsCore());
            new SolrSchemaInstaller(solrClient, properties.getEmbeddingDimension())
                    .install(properties.getEmailsCore(), properties.getCursorsCore());
        };
    }
}
