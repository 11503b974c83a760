package com.chat.relay.service.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * OpenAPI/Swagger configuration for the intake and stats endpoints.
 */
@Configuration
public class OpenApiConfig {

    @Value("${server.port:3000}")
    private int serverPort;

    @Bean
    public OpenAPI chatRelayServiceOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Chat Relay Service API")
                        .description("Receives chat events from the game server and relays them to a Discord webhook "
                                + "in time-boxed, rate-limited batches.")
                        .version("1.0.0"))
                .servers(List.of(
                        new Server()
                                .url("http://localhost:" + serverPort)
                                .description("Local server")
                ));
    }
}
