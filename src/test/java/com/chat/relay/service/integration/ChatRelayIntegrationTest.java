package com.chat.relay.service.integration;

import com.chat.relay.service.dispatch.DispatchOutcome;
import com.chat.relay.service.dispatch.RateLimitScope;
import com.chat.relay.service.dispatch.WebhookSender;
import com.chat.relay.service.format.Batch;
import com.chat.relay.service.ingest.ChatEvent;
import com.chat.relay.service.stats.RelayStats;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * End-to-end test from the HTTP intake to the webhook, with the webhook
 * replaced by a recording sender.
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class ChatRelayIntegrationTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private RecordingSender sender;

    @Autowired
    private RelayStats stats;

    @Test
    void acceptedMessages_areDeliveredInOrder() throws Exception {
        long sentBefore = stats.getTotalSent();
        for (int i = 0; i < 3; i++) {
            submit("ordered-" + i);
        }

        await().atMost(5, TimeUnit.SECONDS)
                .until(() -> sender.deliveredMessages("ordered-").size() == 3);

        assertThat(sender.deliveredMessages("ordered-"))
                .containsExactly("ordered-0", "ordered-1", "ordered-2");
        assertThat(sender.contents()).anySatisfy(content ->
                assertThat(content).contains("**Alice** (Lyra) [Say]: ordered-0"));
        assertThat(stats.getTotalSent() - sentBefore).isGreaterThanOrEqualTo(3);

        mockMvc.perform(get("/stats"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.messages.totalSent").isNumber());
    }

    @Test
    void rateLimitedBatch_isRetriedAfterBackoff() throws Exception {
        long rateLimitsBefore = stats.getRateLimits(RateLimitScope.SHARED);
        sender.rateLimitNext(new DispatchOutcome.RateLimited(Duration.ofMillis(300), RateLimitScope.SHARED));

        submit("limited-0");
        submit("limited-1");

        await().atMost(5, TimeUnit.SECONDS)
                .until(() -> sender.deliveredMessages("limited-").size() == 2);

        assertThat(sender.deliveredMessages("limited-")).containsExactly("limited-0", "limited-1");
        assertThat(stats.getRateLimits(RateLimitScope.SHARED) - rateLimitsBefore).isEqualTo(1);
    }

    private void submit(String message) throws Exception {
        mockMvc.perform(get("/message")
                        .param("message", message)
                        .param("sender", "Alice")
                        .param("character", "Lyra")
                        .param("radius", "say"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data").value("ok"));
    }

    @TestConfiguration
    static class RecordingSenderConfiguration {

        @Bean
        @Primary
        RecordingSender recordingSender() {
            return new RecordingSender();
        }
    }

    /**
     * Records every successfully delivered batch. A scripted outcome, when
     * set, is returned once instead of success.
     */
    static class RecordingSender implements WebhookSender {

        private final List<Batch> delivered = new CopyOnWriteArrayList<>();
        private final AtomicReference<DispatchOutcome> next = new AtomicReference<>();

        void rateLimitNext(DispatchOutcome outcome) {
            next.set(outcome);
        }

        @Override
        public DispatchOutcome send(Batch batch) {
            DispatchOutcome scripted = next.getAndSet(null);
            if (scripted != null) {
                return scripted;
            }
            delivered.add(batch);
            return DispatchOutcome.success();
        }

        List<String> deliveredMessages(String prefix) {
            List<String> messages = new ArrayList<>();
            for (Batch batch : delivered) {
                for (ChatEvent event : batch.events()) {
                    if (event.message().startsWith(prefix)) {
                        messages.add(event.message());
                    }
                }
            }
            return messages;
        }

        List<String> contents() {
            return delivered.stream().map(Batch::content).toList();
        }
    }
}
