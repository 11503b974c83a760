package com.chat.relay.service.api.dto;

import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Chat event as submitted by the game server, bound from query or form parameters.
 *
 * Unknown parameters are ignored.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChatMessageRequest {

    @Size(max = 4000, message = "message must not exceed 4000 characters")
    private String message;

    @Size(max = 200, message = "sender must not exceed 200 characters")
    private String sender;

    @Size(max = 200, message = "character must not exceed 200 characters")
    private String character;

    /**
     * Say, shout, whisper, ... free form.
     */
    @Size(max = 50, message = "radius must not exceed 50 characters")
    private String radius;

    @Size(max = 200, message = "location must not exceed 200 characters")
    private String location;

    @Size(max = 50, message = "channel must not exceed 50 characters")
    private String channel;
}
