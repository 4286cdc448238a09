package dev.aparikh.semanticmail.config;

import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.unit.DataSize;
import org.springframework.validation.annotation.Validated;

/**
 * Limits for attachment text extraction.
 */
@Validated
@ConfigurationProperties(prefix = "attachment")
public class AttachmentProperties {

    @NotNull
    private DataSize maxSize = DataSize.ofMegabytes(10);

    public DataSize getMaxSize() {
        return maxSize;
    }

    public void setMaxSize(DataSize maxSize) {
        this.maxSize = maxSize;
    }
}
