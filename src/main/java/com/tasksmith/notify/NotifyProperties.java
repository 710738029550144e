package com.tasksmith.notify;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "tasksmith.notify")
public class NotifyProperties {

    /** Default webhook; the {@code notification_webhook_url} setting takes precedence. */
    private String webhookUrl = "";
    private Duration connectTimeout = Duration.ofSeconds(5);

    public String getWebhookUrl() { return webhookUrl; }
    public void setWebhookUrl(String webhookUrl) { this.webhookUrl = webhookUrl; }
    public Duration getConnectTimeout() { return connectTimeout; }
    public void setConnectTimeout(Duration connectTimeout) { this.connectTimeout = connectTimeout; }
}
