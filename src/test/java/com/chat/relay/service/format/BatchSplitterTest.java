package com.chat.relay.service.format;

import com.chat.relay.service.config.WebhookConfig;
import com.chat.relay.service.ingest.ChatEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;

class BatchSplitterTest {

    private static final Instant RECEIVED = Instant.parse("2026-01-01T00:00:00Z");

    private WebhookConfig webhookConfig;
    private BatchSplitter splitter;

    @BeforeEach
    void setUp() {
        webhookConfig = new WebhookConfig();
        webhookConfig.setUrl("http://localhost/webhook");
        // lines are the raw message text
        MessageFormatter plain = event -> event.message().isEmpty()
                ? Optional.empty()
                : Optional.of(event.message());
        splitter = new BatchSplitter(plain, webhookConfig);
    }

    @Test
    void split_shortEvents_fitInOneBatch() {
        List<Batch> batches = splitter.plan(events(25, 10), 0).batches();

        assertThat(batches).hasSize(1);
        assertThat(batches.get(0).size()).isEqualTo(25);
        assertThat(batches.get(0).content()).startsWith("0000000000\n0000000001");
    }

    @Test
    void split_respectsCharacterBudgetAndOrder() {
        List<ChatEvent> events = events(100, 99);

        List<Batch> batches = splitter.plan(events, 0).batches();

        assertThat(batches).hasSize(6);
        assertThat(batches).allSatisfy(batch -> {
            assertThat(batch.length()).isLessThanOrEqualTo(webhookConfig.getSafeCharLimit());
            assertThat(batch.events()).isNotEmpty();
        });
        assertThat(batches.get(0).size()).isEqualTo(19);
        assertThat(batches.get(5).size()).isEqualTo(5);

        List<ChatEvent> flattened = new ArrayList<>();
        batches.forEach(batch -> flattened.addAll(batch.events()));
        assertThat(flattened).containsExactlyElementsOf(events);
    }

    @Test
    void split_oversizedEvent_isTruncatedAndSentAlone() {
        ChatEvent before = event("x");
        ChatEvent huge = event("a".repeat(2500));
        ChatEvent after = event("y");

        List<Batch> batches = splitter.plan(List.of(before, huge, after), 0).batches();

        assertThat(batches).hasSize(3);
        Batch alone = batches.get(1);
        assertThat(alone.events()).containsExactly(huge);
        assertThat(alone.content()).hasSize(2000);
        assertThat(alone.content()).isEqualTo("a".repeat(1997) + "...");
    }

    @Test
    void split_emptyMessages_produceNoBatch() {
        assertThat(splitter.plan(List.of(event(""), event("")), 0).batches()).isEmpty();

        List<Batch> batches = splitter.plan(List.of(event(""), event("hi"), event("")), 0).batches();
        assertThat(batches).hasSize(1);
        assertThat(batches.get(0).content()).isEqualTo("hi");
    }

    @Test
    void plan_requestCap_defersRemainingEventsInOrder() {
        List<ChatEvent> events = events(100, 99);

        DispatchPlan plan = splitter.plan(events, 2);

        assertThat(plan.batches()).hasSize(2);
        assertThat(plan.batches().get(0).size() + plan.batches().get(1).size()).isEqualTo(38);
        assertThat(plan.deferred()).containsExactlyElementsOf(events.subList(38, 100));
    }

    @Test
    void plan_withoutCap_defersNothing() {
        DispatchPlan plan = splitter.plan(events(100, 99), 0);

        assertThat(plan.batches()).hasSize(6);
        assertThat(plan.deferred()).isEmpty();
    }

    @Test
    void truncate_neverSplitsSurrogatePair() {
        String text = "a".repeat(1996) + "😀" + "b".repeat(100);

        String truncated = BatchSplitter.truncate(text, 2000);

        assertThat(truncated).endsWith("...");
        assertThat(truncated).hasSize(1999);
        assertThat(Character.isHighSurrogate(truncated.charAt(truncated.length() - 4))).isFalse();
    }

    @Test
    void truncate_shortText_isUnchanged() {
        assertThat(BatchSplitter.truncate("hello", 2000)).isEqualTo("hello");
    }

    private static List<ChatEvent> events(int count, int length) {
        return IntStream.range(0, count)
                .mapToObj(i -> event(String.format("%0" + length + "d", i)))
                .toList();
    }

    private static ChatEvent event(String message) {
        return new ChatEvent("Alice", "", message, "say", "", "", RECEIVED);
    }
}
