package dev.aparikh.semanticmail.config;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Typed configuration properties for the Solr connection and the cores this service owns.
 */
@Validated
@ConfigurationProperties(prefix = "solr")
public class SolrConfigurationProperties {

    @NotBlank
    private String baseUrl;

    @NotBlank
    private String emailsCore = "emails";

    @NotBlank
    private String cursorsCore = "sync_cursors";

    // DenseVectorField in Solr 9 accepts at most 1024 dimensions
    @Positive
    @Max(1024)
    private int embeddingDimension = 1024;

    private boolean installSchema = false;

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public String getEmailsCore() {
        return stripSlashes(emailsCore);
    }

    public void setEmailsCore(String emailsCore) {
        this.emailsCore = emailsCore;
    }

    public String getCursorsCore() {
        return stripSlashes(cursorsCore);
    }

    public void setCursorsCore(String cursorsCore) {
        this.cursorsCore = cursorsCore;
    }

    public int getEmbeddingDimension() {
        return embeddingDimension;
    }

    public void setEmbeddingDimension(int embeddingDimension) {
        this.embeddingDimension = embeddingDimension;
    }

    public boolean isInstallSchema() {
        return installSchema;
    }

    public void setInstallSchema(boolean installSchema) {
        this.installSchema = installSchema;
    }

    private static String stripSlashes(String core) {
        if (core == null) return null;
        String c = core.startsWith("/") ? core.substring(1) : core;
        return c.endsWith("/") ? c.substring(0, c.length() - 1) : c;
    }
}
