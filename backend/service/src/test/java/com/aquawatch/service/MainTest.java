package com.aquawatch.service;

import com.aquawatch.service.alert.AlertPublisher;
import com.aquawatch.service.alert.WebhookAlertPublisher;
import com.aquawatch.service.config.ServiceConfig;
import org.junit.jupiter.api.Test;

import java.net.http.HttpClient;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MainTest {
    @Test
    void webhookPublisherIsUsedOnlyWhenUrlConfigured() {
        HttpClient httpClient = HttpClient.newHttpClient();

        AlertPublisher withWebhook = Main.alertPublisher(config("https://hooks.example.com/aquawatch"), httpClient);
        AlertPublisher withoutWebhook = Main.alertPublisher(config(" "), httpClient);

        assertTrue(withWebhook instanceof WebhookAlertPublisher);
        assertFalse(withoutWebhook instanceof WebhookAlertPublisher);
        assertDoesNotThrow(() -> withoutWebhook.publish("AquaWatch Anomalies Detected (1)", "Site 03339000 anomalous"));
    }

    private static ServiceConfig config(String webhookUrl) {
        return new ServiceConfig(0, null, 0, null, null, null, webhookUrl, null);
    }
}
