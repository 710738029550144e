package com.tasksmith.dispatch.api;

import com.tasksmith.core.persistence.PlanStore;
import com.tasksmith.core.queue.QueueProperties;
import com.tasksmith.notify.NotifyProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Runtime-mutable application settings. Stored values override the configured defaults.
 */
@RestController
@RequestMapping("/api/v1/settings")
public class SettingsController {

    private static final Logger log = LoggerFactory.getLogger(SettingsController.class);

    private static final Set<String> KNOWN_KEYS = Set.of(
            PlanStore.SETTING_QUEUE_PARALLEL_ENABLED,
            PlanStore.SETTING_NOTIFICATION_WEBHOOK_URL);

    private final PlanStore store;
    private final QueueProperties queueProperties;
    private final NotifyProperties notifyProperties;

    public SettingsController(PlanStore store, QueueProperties queueProperties, NotifyProperties notifyProperties) {
        this.store = store;
        this.queueProperties = queueProperties;
        this.notifyProperties = notifyProperties;
    }

    @GetMapping
    public Map<String, String> getSettings() {
        Map<String, String> settings = new LinkedHashMap<>();
        settings.put(PlanStore.SETTING_QUEUE_PARALLEL_ENABLED,
                store.getSetting(PlanStore.SETTING_QUEUE_PARALLEL_ENABLED)
                        .orElse(String.valueOf(queueProperties.isParallelEnabled())));
        settings.put(PlanStore.SETTING_NOTIFICATION_WEBHOOK_URL,
                store.getSetting(PlanStore.SETTING_NOTIFICATION_WEBHOOK_URL)
                        .orElse(notifyProperties.getWebhookUrl() == null ? "" : notifyProperties.getWebhookUrl()));
        return settings;
    }

    @PutMapping
    public ResponseEntity<?> updateSettings(@RequestBody Map<String, String> updates) {
        for (var entry : updates.entrySet()) {
            if (!KNOWN_KEYS.contains(entry.getKey())) {
                return ApiErrors.error(HttpStatus.BAD_REQUEST, "Unknown setting: " + entry.getKey());
            }
            String value = entry.getValue() == null ? "" : entry.getValue().strip();
            if (PlanStore.SETTING_QUEUE_PARALLEL_ENABLED.equals(entry.getKey())
                    && !value.equals("true") && !value.equals("false")) {
                return ApiErrors.error(HttpStatus.BAD_REQUEST,
                        PlanStore.SETTING_QUEUE_PARALLEL_ENABLED + " must be true or false");
            }
        }
        updates.forEach((key, value) -> {
            store.putSetting(key, value == null ? "" : value.strip());
            log.info("Setting {} updated", key);
        });
        return ResponseEntity.ok(getSettings());
    }
}
