package com.chat.relay.service.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Display options for relayed chat lines.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "relay.format")
public class FormatConfig {

    /**
     * Discord timestamp style: t, T, d, D, f, F or R. Empty disables the timestamp.
     */
    private String timestampStyle = "T";

    private boolean showCharacterName = true;

    private boolean showRadius = true;

    private boolean showLocation = false;

    private boolean showChannel = true;
}
