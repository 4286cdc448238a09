package dev.aparikh.semanticmail.config;

import dev.aparikh.semanticmail.ratelimit.RateLimit;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.Map;

/**
 * Call budgets per external dependency, enforced in process by the rate governor.
 */
@Validated
@ConfigurationProperties(prefix = "rate")
public class RateProperties {

    @Valid
    private Limit mailbox = new Limit(Duration.ofSeconds(1), 25);

    @Valid
    private Limit embedding = new Limit(Duration.ofSeconds(60), 500);

    /** Limits keyed by the dependency names used for governed calls. */
    public Map<String, RateLimit> toLimits(String mailboxKey, String embeddingKey) {
        return Map.of(mailboxKey, mailbox.toRateLimit(), embeddingKey, embedding.toRateLimit());
    }

    public Limit getMailbox() {
        return mailbox;
    }

    public void setMailbox(Limit mailbox) {
        this.mailbox = mailbox;
    }

    public Limit getEmbedding() {
        return embedding;
    }

    public void setEmbedding(Limit embedding) {
        this.embedding = embedding;
    }

    public static class Limit {

        @NotNull
        private Duration window;

        @Positive
        private int maxCalls;

        public Limit() {
        }

        public Limit(Duration window, int maxCalls) {
            this.window = window;
            this.maxCalls = maxCalls;
        }

        RateLimit toRateLimit() {
            return new RateLimit(window, maxCalls);
        }

        public Duration getWindow() {
            return window;
        }

        public void setWindow(Duration window) {
            this.window = window;
        }

        public int getMaxCalls() {
            return maxCalls;
        }

        public void setMaxCalls(int maxCalls) {
            this.maxCalls = maxCalls;
        }
    }
}
