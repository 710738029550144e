package com.tasksmith.notify;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpServer;
import com.tasksmith.core.events.EventBus;
import com.tasksmith.core.events.EventLevel;
import com.tasksmith.core.events.RunEvent;
import com.tasksmith.core.events.RunEventType;
import com.tasksmith.core.metrics.TasksmithMetrics;
import com.tasksmith.core.persistence.InMemoryPlanStore;
import com.tasksmith.core.persistence.PlanStore;
import com.tasksmith.execution.AgentNotice;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class WebhookNotifierTest {

    private static RunEvent event(RunEventType type, String taskId, Map<String, Object> payload) {
        return new RunEvent("e1", Instant.now(), "r1", "plan-1", taskId, type, EventLevel.INFO, payload);
    }

    @Nested
    @DisplayName("format")
    class Format {

        @Test
        @DisplayName("task status changes name the task and its status")
        void taskStatus() {
            String text = WebhookNotifier.format(event(RunEventType.TASK_STATUS, "t1", Map.of("status", "completed")));

            assertEquals("Task `t1` is now **completed**.", text);
        }

        @Test
        @DisplayName("merges include the resulting commit")
        void merged() {
            String text = WebhookNotifier.format(event(RunEventType.TASK_MERGED, "t1", Map.of("commit", "abc123")));

            assertEquals("Task `t1` merged (abc123).", text);
        }

        @Test
        @DisplayName("queue results carry outcome and reason")
        void queueFinished() {
            String text = WebhookNotifier.format(event(RunEventType.QUEUE_FINISHED, null,
                    Map.of("outcome", "failed", "message", "Task t1 failed.")));

            assertEquals("Queue for plan `plan-1` finished: **failed**. Task t1 failed.", text);
        }

        @Test
        @DisplayName("only review notices are forwarded among info events")
        void reviewsOnly() {
            String review = WebhookNotifier.format(event(RunEventType.INFO, "t1",
                    Map.of("kind", AgentNotice.KIND_REVIEW, "message", "Approved")));
            String other = WebhookNotifier.format(event(RunEventType.INFO, "t1",
                    Map.of("kind", "stage_transition", "message", "Testing")));

            assertEquals("Review of task `t1`: Approved", review);
            assertNull(other);
        }

        @Test
        @DisplayName("logs are never forwarded")
        void logsIgnored() {
            assertNull(WebhookNotifier.format(event(RunEventType.LOG, "t1", Map.of("message", "compiling"))));
        }

        @Test
        @DisplayName("long content is truncated")
        void truncated() {
            String text = WebhookNotifier.format(event(RunEventType.QUEUE_FINISHED, null,
                    Map.of("outcome", "failed", "message", "x".repeat(5000))));

            assertEquals(1900, text.length());
        }
    }

    @Nested
    @DisplayName("delivery")
    class Delivery {

        private InMemoryPlanStore store;
        private NotifyProperties properties;
        private SimpleMeterRegistry registry;
        private EventBus bus;
        private List<String[]> sent;
        private WebhookNotifier notifier;

        @BeforeEach
        void setUp() {
            store = new InMemoryPlanStore();
            properties = new NotifyProperties();
            registry = new SimpleMeterRegistry();
            bus = new EventBus();
            sent = new CopyOnWriteArrayList<>();
            notifier = new WebhookNotifier(bus, store, properties, new ObjectMapper(), new TasksmithMetrics(registry)) {
                @Override
                CompletableFuture<Void> send(String url, String content) {
                    sent.add(new String[]{url, content});
                    return CompletableFuture.completedFuture(null);
                }
            };
            notifier.start();
        }

        private void publishStatus() {
            bus.publish(event(RunEventType.TASK_STATUS, "t1", Map.of("status", "failed")));
        }

        @Test
        @DisplayName("nothing is sent without a configured URL")
        void noUrl() {
            publishStatus();

            assertTrue(sent.isEmpty());
        }

        @Test
        @DisplayName("the configured URL is used when no setting overrides it")
        void configuredUrl() {
            properties.setWebhookUrl("http://hooks.local/a");

            publishStatus();

            assertEquals(1, sent.size());
            assertEquals("http://hooks.local/a", sent.get(0)[0]);
            assertEquals("Task `t1` is now **failed**.", sent.get(0)[1]);
        }

        @Test
        @DisplayName("the settings URL takes precedence over configuration")
        void settingOverrides() {
            properties.setWebhookUrl("http://hooks.local/a");
            store.putSetting(PlanStore.SETTING_NOTIFICATION_WEBHOOK_URL, "http://hooks.local/b");

            publishStatus();

            assertEquals("http://hooks.local/b", sent.get(0)[0]);
        }

        @Test
        @DisplayName("unsubscribes on stop")
        void stops() {
            properties.setWebhookUrl("http://hooks.local/a");
            notifier.stop();

            publishStatus();

            assertTrue(sent.isEmpty());
        }
    }

    @Nested
    @DisplayName("http")
    class Http {

        @Test
        @DisplayName("posts the content as JSON")
        void postsJson() throws Exception {
            var bodies = new CopyOnWriteArrayList<String>();
            HttpServer server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
            server.createContext("/hook", exchange -> {
                bodies.add(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
                exchange.sendResponseHeaders(204, -1);
                exchange.close();
            });
            server.start();
            try {
                var registry = new SimpleMeterRegistry();
                var notifier = new WebhookNotifier(new EventBus(), new InMemoryPlanStore(), new NotifyProperties(),
                        new ObjectMapper(), new TasksmithMetrics(registry));
                String url = "http://127.0.0.1:" + server.getAddress().getPort() + "/hook";

                notifier.send(url, "Task `t1` is now **completed**.").get(10, TimeUnit.SECONDS);

                assertEquals(List.of("{\"content\":\"Task `t1` is now **completed**.\"}"), bodies);
                assertNull(registry.find("tasksmith.notifications.failed").counter());
            } finally {
                server.stop(0);
            }
        }

        @Test
        @DisplayName("an invalid URL counts as a failed notification")
        void invalidUrl() throws Exception {
            var registry = new SimpleMeterRegistry();
            var notifier = new WebhookNotifier(new EventBus(), new InMemoryPlanStore(), new NotifyProperties(),
                    new ObjectMapper(), new TasksmithMetrics(registry));

            notifier.send("not a url", "hello").get(5, TimeUnit.SECONDS);

            assertEquals(1.0, registry.find("tasksmith.notifications.failed").counter().count());
        }
    }
}
