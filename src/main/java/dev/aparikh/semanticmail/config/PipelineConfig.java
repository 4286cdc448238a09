package dev.aparikh.semanticmail.config;

import dev.aparikh.semanticmail.embedding.EmbeddingProvider;
import dev.aparikh.semanticmail.filter.FilterEngine;
import dev.aparikh.semanticmail.indexing.EmailStore;
import dev.aparikh.semanticmail.indexing.SyncCursorStore;
import dev.aparikh.semanticmail.indexing.VectorStore;
import dev.aparikh.semanticmail.mailbox.MailboxSource;
import dev.aparikh.semanticmail.ratelimit.RateGovernor;
import dev.aparikh.semanticmail.sync.MdcTaskExecutor;
import dev.aparikh.semanticmail.sync.MessagePreparer;
import dev.aparikh.semanticmail.sync.RetryExecutor;
import dev.aparikh.semanticmail.sync.SyncOrchestrator;
import dev.aparikh.semanticmail.text.HtmlTextExtractor;
import dev.aparikh.semanticmail.text.TextChunker;
import dev.aparikh.semanticmail.text.TextNormalizer;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Wires the text, filter and sync components together.
 */
@Configuration
@EnableConfigurationProperties({SyncProperties.class, TextProperties.class, FilterProperties.class,
        RateProperties.class})
class PipelineConfig {

    @Bean
    Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    TextNormalizer textNormalizer() {
        return new TextNormalizer();
    }

    @Bean
    TextChunker textChunker(TextNormalizer normalizer, TextProperties text) {
        return new TextChunker(normalizer, text.getMaxTokens(), text.getBoundaryWindow());
    }

    @Bean
    HtmlTextExtractor htmlTextExtractor() {
        return new HtmlTextExtractor();
    }

    @Bean
    MessagePreparer messagePreparer(TextNormalizer normalizer, TextChunker chunker, HtmlTextExtractor html,
                                    TextProperties text) {
        return new MessagePreparer(normalizer, chunker, html, text.getMaxChunkSize());
    }

    @Bean
    FilterEngine filterEngine(FilterProperties filter) {
        return new FilterEngine(filter.toPolicy());
    }

    // one governor per process so every caller draws from the same budget
    @Bean
    RateGovernor rateGovernor(Clock clock) {
        return new RateGovernor(clock);
    }

    @Bean
    MdcTaskExecutor syncWorkers(SyncProperties sync) {
        return MdcTaskExecutor.fixed("sync-worker", sync.getWorkers());
    }

    @Bean
    MdcTaskExecutor callExecutor() {
        return MdcTaskExecutor.cached("external-call");
    }

    @Bean
    RetryExecutor retryExecutor(RateGovernor governor, RateProperties rates,
                                @Qualifier("callExecutor") MdcTaskExecutor callExecutor,
                                Clock clock, SyncProperties sync) {
        return new RetryExecutor(governor, rates.toLimits(RetryExecutor.MAILBOX, RetryExecutor.EMBEDDING), callExecutor, clock,
                sync.getCallTimeout(), sync.getMaxAttempts(), sync.getInitialBackoff(), sync.getMaxBackoff(),
                duration -> Thread.sleep(duration.toMillis()));
    }

    @Bean
    SyncOrchestrator syncOrchestrator(MailboxSource mailbox, EmailStore emailStore, VectorStore vectorStore,
                                      SyncCursorStore cursorStore, FilterEngine filterEngine,
                                      MessagePreparer preparer, EmbeddingProvider embeddings,
                                      RetryExecutor retry, @Qualifier("syncWorkers") MdcTaskExecutor workers,
                                      SyncProperties sync, Clock clock) {
        return new SyncOrchestrator(mailbox, emailStore, vectorStore, cursorStore, filterEngine, preparer,
                embeddings, retry, workers, sync, clock);
    }
}
