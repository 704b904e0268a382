package com.polygonmev.arb.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.polygonmev.arb.infra.alert.AlertNotifier;
import com.polygonmev.arb.infra.alert.LoggingAlertNotifier;
import com.polygonmev.arb.infra.alert.RateLimitedAlertNotifier;
import com.polygonmev.arb.infra.alert.WebhookAlertNotifier;
import lombok.extern.slf4j.Slf4j;
import okhttp3.OkHttpClient;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.TimeUnit;

@Slf4j
@Configuration
@EnableConfigurationProperties(EngineProperties.class)
public class EngineConfiguration {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public OkHttpClient httpClient() {
        return new OkHttpClient.Builder()
                .connectTimeout(10, TimeUnit.SECONDS)
                .readTimeout(30, TimeUnit.SECONDS)
                .pingInterval(20, TimeUnit.SECONDS) // keeps the mempool WebSocket alive
                .build();
    }

    @Bean
    public AlertNotifier alertNotifier(EngineProperties properties, OkHttpClient httpClient, ObjectMapper objectMapper,
                                       Clock clock) {
        String webhookUrl = properties.alerts().webhookUrl();
        AlertNotifier delivery;
        if (webhookUrl == null || webhookUrl.isBlank()) {
            log.warn("[ALERT] No webhook configured, alerts are logged only");
            delivery = new LoggingAlertNotifier();
        } else {
            delivery = new WebhookAlertNotifier(httpClient, objectMapper, webhookUrl, clock);
        }
        return new RateLimitedAlertNotifier(delivery, properties.alerts().minIntervalPerSubject(), clock);
    }
}
