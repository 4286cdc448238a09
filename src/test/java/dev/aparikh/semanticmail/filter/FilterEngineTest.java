package dev.aparikh.semanticmail.filter;

import dev.aparikh.semanticmail.model.FilterReason;
import dev.aparikh.semanticmail.model.MailboxMessage;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class FilterEngineTest {

    private final FilterEngine engine = new FilterEngine(FilterPolicy.defaults());

    @Test
    void personalEmailIsKept() {
        FilterDecision decision = engine.classify(
                message("m1", "Alice <alice@friends.example>", "Lunch tomorrow?", "Want to grab lunch at noon?"),
                Set.of());

        assertThat(decision.isDuplicate()).isFalse();
        assertThat(decision.isFiltered()).isFalse();
        assertThat(decision.filterReason()).isEqualTo(FilterReason.NONE);
        assertThat(decision.isIndexable()).isTrue();
    }

    @Test
    void knownIdIsDuplicateBeforeAnyOtherCheck() {
        MailboxMessage marketing = message("m1", "deals@mailchimp.com", "Huge sale", "unsubscribe for discounts");

        FilterDecision decision = engine.classify(marketing, Set.of("m1"));

        assertThat(decision.isDuplicate()).isTrue();
        assertThat(decision.isFiltered()).isFalse();
        assertThat(decision.isIndexable()).isFalse();
    }

    @Test
    void missingProviderIdIsProcessingError() {
        FilterDecision decision = engine.classify(message(null, "a@friends.example", "Hi", "Hello"), Set.of());

        assertThat(decision.isFiltered()).isTrue();
        assertThat(decision.filterReason()).isEqualTo(FilterReason.PROCESSING_ERROR);
    }

    @Test
    void oversizedBodyIsProcessingError() {
        FilterPolicy policy = new FilterPolicy(true, true, true, false, 100, List.of(), List.of());
        FilterEngine small = new FilterEngine(policy);

        FilterDecision decision = small.classify(
                message("m1", "a@friends.example", "Big", "x".repeat(101)), Set.of());

        assertThat(decision.filterReason()).isEqualTo(FilterReason.PROCESSING_ERROR);
    }

    @Test
    void blacklistedDomainAndSubdomainsAreMarketing() {
        assertThat(engine.classify(message("m1", "news@linkedin.com", "Hi", "Hello"), Set.of()).filterReason())
                .isEqualTo(FilterReason.MARKETING);
        assertThat(engine.classify(message("m2", "Jobs <jobs@e.linkedin.com>", "Hi", "Hello"), Set.of()).filterReason())
                .isEqualTo(FilterReason.MARKETING);
    }

    @Test
    void wildcardDomainPatternsMatch() {
        FilterPolicy policy = new FilterPolicy(true, false, false, false, FilterPolicy.DEFAULT_MAX_EMAIL_SIZE,
                List.of("promo*.example"), List.of());
        FilterEngine wildcard = new FilterEngine(policy);

        assertThat(wildcard.classify(message("m1", "a@promotions.example", "Hi", "Hello"), Set.of()).isFiltered())
                .isTrue();
        assertThat(wildcard.classify(message("m2", "a@friends.example", "Hi", "Hello"), Set.of()).isFiltered())
                .isFalse();
    }

    @Test
    void whitelistedDomainWinsOverBlacklistAndContent() {
        FilterPolicy policy = new FilterPolicy(true, true, true, false, FilterPolicy.DEFAULT_MAX_EMAIL_SIZE,
                List.of("partner.example"), List.of("partner.example"));
        FilterEngine engine = new FilterEngine(policy);

        FilterDecision decision = engine.classify(
                message("m1", "team@partner.example", "Newsletter sale", "unsubscribe for offers"), Set.of());

        assertThat(decision.isFiltered()).isFalse();
    }

    @Test
    void listHeadersMarkBulkMail() {
        MailboxMessage msg = message("m1", "list@friends.example", "Weekly", "Hello",
                Map.of("list-unsubscribe", "<mailto:leave@friends.example>"));

        assertThat(engine.classify(msg, Set.of()).filterReason()).isEqualTo(FilterReason.MARKETING);
    }

    @Test
    void autoSubmittedHeaderMarksAutomated() {
        MailboxMessage auto = message("m1", "bob@friends.example", "Re: plans", "I am away",
                Map.of("Auto-Submitted", "auto-replied"));
        MailboxMessage manual = message("m2", "bob@friends.example", "Re: plans", "Sounds good",
                Map.of("Auto-Submitted", "no"));

        assertThat(engine.classify(auto, Set.of()).filterReason()).isEqualTo(FilterReason.AUTOMATED);
        assertThat(engine.classify(manual, Set.of()).isFiltered()).isFalse();
    }

    @Test
    void noReplySenderIsAutomated() {
        FilterDecision decision = engine.classify(
                message("m1", "no-reply@shop.example", "Your receipt", "Thanks for your order"), Set.of());

        assertThat(decision.filterReason()).isEqualTo(FilterReason.AUTOMATED);
    }

    @Test
    void twoMarketingSignalsMarkMarketing() {
        FilterDecision decision = engine.classify(
                message("m1", "hello@shop.example", "Big sale this weekend", "Get a discount on everything"),
                Set.of());

        assertThat(decision.filterReason()).isEqualTo(FilterReason.MARKETING);
    }

    @Test
    void singleMarketingWordIsNotEnough() {
        FilterDecision decision = engine.classify(
                message("m1", "carol@friends.example", "Garage sale", "Come by on Saturday"), Set.of());

        assertThat(decision.isFiltered()).isFalse();
    }

    @Test
    void notificationHeavyMailIsAutomatedOnlyInStrictMode() {
        MailboxMessage msg = message("m1", "team@tool.example", "Your weekly digest",
                "New notification: a reminder and an alert are waiting");
        FilterPolicy strict = new FilterPolicy(true, true, true, true, FilterPolicy.DEFAULT_MAX_EMAIL_SIZE,
                List.of(), List.of());

        assertThat(engine.classify(msg, Set.of()).isFiltered()).isFalse();
        assertThat(new FilterEngine(strict).classify(msg, Set.of()).filterReason())
                .isEqualTo(FilterReason.AUTOMATED);
    }

    @Test
    void classificationIsDeterministic() {
        MailboxMessage msg = message("m1", "deals@shop.example", "Weekend sale", "Special offers inside");

        assertThat(engine.classify(msg, Set.of())).isEqualTo(engine.classify(msg, Set.of()));
    }

    @Test
    void contentChecksCanBeDisabled() {
        FilterPolicy policy = new FilterPolicy(true, false, true, false, FilterPolicy.DEFAULT_MAX_EMAIL_SIZE,
                List.of(), List.of());

        FilterDecision decision = new FilterEngine(policy).classify(
                message("m1", "hello@shop.example", "Big sale", "Get a discount"), Set.of());

        assertThat(decision.isFiltered()).isFalse();
    }

    static MailboxMessage message(String id, String sender, String subject, String body) {
        return message(id, sender, subject, body, Map.of());
    }

    static MailboxMessage message(String id, String sender, String subject, String body, Map<String, String> headers) {
        return new MailboxMessage(id, "t-" + id, sender, List.of("me@friends.example"), subject, body, null,
                List.of(), Instant.parse("2025-01-01T10:00:00Z"), List.of("INBOX"), headers);
    }
}
