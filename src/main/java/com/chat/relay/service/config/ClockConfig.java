package com.chat.relay.service.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Time source shared by intake, stats and the dispatch worker.
 */
@Configuration
public class ClockConfig {

    @Bean
    public Clock relayClock() {
        return Clock.systemUTC();
    }
}
