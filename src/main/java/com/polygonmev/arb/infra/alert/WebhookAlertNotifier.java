package com.polygonmev.arb.infra.alert;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import okhttp3.Call;
import okhttp3.Callback;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;

import java.io.IOException;
import java.time.Clock;

/**
 * Posts alerts as JSON to a webhook. Delivery is asynchronous; failures are
 * logged and dropped.
 */
@Slf4j
public class WebhookAlertNotifier implements AlertNotifier {

    private static final MediaType JSON = MediaType.parse("application/json");

    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final String webhookUrl;
    private final Clock clock;

    public WebhookAlertNotifier(OkHttpClient httpClient, ObjectMapper objectMapper, String webhookUrl, Clock clock) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.webhookUrl = webhookUrl;
        this.clock = clock;
    }

    @Override
    public void notify(String subject, String body, AlertPriority priority) {
        String payload;
        try {
            ObjectNode node = objectMapper.createObjectNode();
            node.put("subject", subject);
            node.put("body", body);
            node.put("priority", priority.name());
            node.put("timestamp", clock.instant().toString());
            payload = objectMapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            log.error("[ALERT] Could not encode alert '{}'", subject, e);
            return;
        }

        Request request = new Request.Builder()
                .url(webhookUrl)
                .post(RequestBody.create(payload, JSON))
                .build();

        httpClient.newCall(request).enqueue(new Callback() {
            @Override
            public void onFailure(Call call, IOException e) {
                log.error("[ALERT] Webhook delivery failed for '{}': {}", subject, e.getMessage());
            }

            @Override
            public void onResponse(Call call, Response response) {
                try (response) {
                    if (!response.isSuccessful()) {
                        log.error("[ALERT] Webhook rejected '{}': {}", subject, response.code());
                    } else {
                        log.debug("[ALERT] Delivered '{}'", subject);
                    }
                }
            }
        });
    }
}
