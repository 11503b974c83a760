package com.chat.relay.service.api.controller;

import com.chat.relay.service.api.dto.ApiResponse;
import com.chat.relay.service.api.dto.ChatMessageRequest;
import com.chat.relay.service.ingest.ChatEvent;
import com.chat.relay.service.ingest.ChatIngestionService;
import com.chat.relay.service.ingest.IngestStatus;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ModelAttribute;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestMethod;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.Instant;

/**
 * Controller for chat event intake.
 *
 * Handles GET/POST /message, called by the game server mod for every chat line.
 */
@Slf4j
@RestController
@Tag(name = "Chat Intake", description = "Endpoint receiving chat events from the game server")
@RequiredArgsConstructor
public class MessageIngestController {

    private final ChatIngestionService ingestionService;
    private final Clock clock;

    /**
     * Accepts one chat event.
     *
     * @return 200 with {@code ok} or {@code ignored}, 503 with {@code queue_full}
     */
    @RequestMapping(value = "/message", method = {RequestMethod.GET, RequestMethod.POST})
    @Operation(
            summary = "Submit a chat event",
            description = "Queues a chat event for delivery. The reception time is captured immediately "
                    + "and used as the message timestamp."
    )
    @ApiResponses({
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Event accepted or ignored by the channel filter"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "400", description = "Invalid parameters"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "503", description = "Queue full, event dropped")
    })
    public ResponseEntity<ApiResponse<IngestStatus>> receiveMessage(@Valid @ModelAttribute ChatMessageRequest request) {
        Instant receivedAt = clock.instant();

        ChatEvent event = new ChatEvent(
                request.getSender(),
                request.getCharacter(),
                request.getMessage(),
                request.getRadius(),
                request.getLocation(),
                request.getChannel(),
                receivedAt
        );

        IngestStatus status = ingestionService.submit(event);
        if (status == IngestStatus.QUEUE_FULL) {
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                    .body(ApiResponse.failure(status, "Queue is full, event dropped", "QUEUE_FULL"));
        }
        return ResponseEntity.ok(ApiResponse.success(status));
    }
}
