package dev.aparikh.semanticmail.config;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "text")
public class TextProperties {

    /** Upper bound on the characters of one chunk. */
    @Positive
    private int maxChunkSize = 8000;

    /** Messages estimated above this many tokens are not embedded. */
    @Positive
    private int maxTokens = 10_000;

    /** Share of a chunk, counted from its end, searched for a sentence break. */
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double boundaryWindow = 0.2;

    public int getMaxChunkSize() {
        return maxChunkSize;
    }

    public void setMaxChunkSize(int maxChunkSize) {
        this.maxChunkSize = maxChunkSize;
    }

    public int getMaxTokens() {
        return maxTokens;
    }

    public void setMaxTokens(int maxTokens) {
        this.maxTokens = maxTokens;
    }

    public double getBoundaryWindow() {
        return boundaryWindow;
    }

    public void setBoundaryWindow(double boundaryWindow) {
        this.boundaryWindow = boundaryWindow;
    }
}
