package com.chat.relay.service.config;

import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

import static org.assertj.core.api.Assertions.assertThat;

class WebhookConfigTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withUserConfiguration(WebhookPropertiesConfiguration.class);

    @Test
    void missingUrl_failsStartup() {
        contextRunner.run(context -> assertThat(context).hasFailed());
    }

    @Test
    void placeholderUrl_failsStartup() {
        contextRunner
                .withPropertyValues("relay.webhook.url=YOUR_WEBHOOK_URL_HERE")
                .run(context -> assertThat(context).hasFailed());
    }

    @Test
    void validUrl_bindsWithDefaults() {
        contextRunner
                .withPropertyValues("relay.webhook.url=https://discord.com/api/webhooks/1/token")
                .run(context -> {
                    assertThat(context).hasNotFailed();
                    WebhookConfig config = context.getBean(WebhookConfig.class);
                    assertThat(config.getUsername()).isEqualTo("CONAN_CHAT");
                    assertThat(config.getSafeCharLimit()).isEqualTo(1900);
                    assertThat(config.getHardCharLimit()).isEqualTo(2000);
                    assertThat(config.hasAvatar()).isFalse();
                });
    }

    @Test
    void dispatchConfig_theoreticalCapacity() {
        DispatchConfig config = new DispatchConfig();

        assertThat(config.getTheoreticalCapacity()).isEqualTo(480);

        config.setBatchWindowMs(0);
        assertThat(config.getTheoreticalCapacity()).isZero();
    }

    @Configuration
    @EnableConfigurationProperties(WebhookConfig.class)
    static class WebhookPropertiesConfiguration {
    }
}
