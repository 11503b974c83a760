package com.chat.relay.service.api;

import com.chat.relay.service.stats.RelayStats;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest(properties = {
        "relay.features.dispatch-enabled=false",
        "relay.ingest.max-queue-size=2"
})
@AutoConfigureMockMvc
@ActiveProfiles("test")
class MessageIngestQueueFullTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private RelayStats stats;

    @Test
    void message_queueFull_returns503AndCountsDrop() throws Exception {
        for (int i = 0; i < 2; i++) {
            mockMvc.perform(get("/message").param("message", "m" + i).param("sender", "Alice"))
                    .andExpect(status().isOk());
        }

        mockMvc.perform(get("/message").param("message", "overflow").param("sender", "Alice"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.data").value("queue_full"))
                .andExpect(jsonPath("$.error.code").value("QUEUE_FULL"));

        assertThat(stats.getTotalDropped()).isEqualTo(1);

        mockMvc.perform(get("/actuator/health"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.components.relay.details.relayStatus").value("CRITICAL"));
    }
}
