package com.tasksmith.notify;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tasksmith.core.events.EventBus;
import com.tasksmith.core.events.EventFilter;
import com.tasksmith.core.events.RunEvent;
import com.tasksmith.core.events.RunEventType;
import com.tasksmith.core.metrics.TasksmithMetrics;
import com.tasksmith.core.persistence.PlanStore;
import com.tasksmith.execution.AgentNotice;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Forwards notable events (task status changes, merges, queue results and review outcomes)
 * to a chat-style webhook as {@code {"content": "..."}}. Delivery is fire-and-forget.
 */
@Component
public class WebhookNotifier {

    private static final Logger log = LoggerFactory.getLogger(WebhookNotifier.class);

    private static final int MAX_CONTENT_LENGTH = 1900;

    private final EventBus eventBus;
    private final PlanStore store;
    private final NotifyProperties properties;
    private final ObjectMapper objectMapper;
    private final TasksmithMetrics metrics;
    private final HttpClient httpClient;
    private EventBus.Subscription subscription;

    public WebhookNotifier(EventBus eventBus, PlanStore store, NotifyProperties properties,
                           ObjectMapper objectMapper, TasksmithMetrics metrics) {
        this.eventBus = eventBus;
        this.store = store;
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.metrics = metrics;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(properties.getConnectTimeout())
                .build();
    }

    @PostConstruct
    public void start() {
        subscription = eventBus.subscribe(EventFilter.all().ofTypes(
                RunEventType.TASK_STATUS, RunEventType.TASK_MERGED, RunEventType.QUEUE_FINISHED, RunEventType.INFO),
                this::onEvent);
    }

    @PreDestroy
    public void stop() {
        if (subscription != null) {
            subscription.unsubscribe();
        }
    }

    void onEvent(RunEvent event) {
        String content = format(event);
        if (content == null) {
            return;
        }
        Optional<String> url = webhookUrl();
        if (url.isEmpty()) {
            return;
        }
        send(url.get(), content);
    }

    /**
     * Text for a forwarded event, or null if the event is not forwarded.
     */
    static String format(RunEvent event) {
        String task = event.taskId() != null ? " `" + event.taskId() + "`" : "";
        String text = switch (event.type()) {
            case TASK_STATUS -> {
                Object status = event.payload().get("status");
                yield status == null ? null : "Task" + task + " is now **" + status + "**.";
            }
            case TASK_MERGED -> "Task" + task + " merged (" + event.payload().getOrDefault("commit", "?") + ").";
            case QUEUE_FINISHED -> "Queue for plan `" + event.planId() + "` finished: **"
                    + event.payload().getOrDefault("outcome", "unknown") + "**. " + event.message();
            case INFO -> AgentNotice.KIND_REVIEW.equals(event.payload().get("kind"))
                    ? "Review of task" + task + ": " + event.message()
                    : null;
            default -> null;
        };
        if (text == null) {
            return null;
        }
        return text.length() <= MAX_CONTENT_LENGTH ? text : text.substring(0, MAX_CONTENT_LENGTH);
    }

    private Optional<String> webhookUrl() {
        Optional<String> fromSettings = store.getSetting(PlanStore.SETTING_NOTIFICATION_WEBHOOK_URL)
                .filter(value -> !value.isBlank());
        if (fromSettings.isPresent()) {
            return fromSettings;
        }
        return Optional.ofNullable(properties.getWebhookUrl()).filter(value -> !value.isBlank());
    }

    CompletableFuture<Void> send(String url, String content) {
        String body;
        try {
            body = objectMapper.writeValueAsString(Map.of("content", content));
        } catch (JsonProcessingException e) {
            log.warn("Could not encode webhook payload: {}", e.getMessage());
            metrics.recordNotificationFailure();
            return CompletableFuture.completedFuture(null);
        }

        HttpRequest request;
        try {
            request = HttpRequest.newBuilder(URI.create(url))
                    .timeout(Duration.ofSeconds(10))
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(body))
                    .build();
        } catch (IllegalArgumentException e) {
            log.warn("Invalid webhook URL {}: {}", url, e.getMessage());
            metrics.recordNotificationFailure();
            return CompletableFuture.completedFuture(null);
        }

        return httpClient.sendAsync(request, HttpResponse.BodyHandlers.discarding())
                .handle((response, error) -> {
                    if (error != null) {
                        log.warn("Webhook delivery failed: {}", error.getMessage());
                        metrics.recordNotificationFailure();
                    } else if (response.statusCode() >= 300) {
                        log.warn("Webhook responded with HTTP {}", response.statusCode());
                        metrics.recordNotificationFailure();
                    }
                    return null;
                });
    }
}
