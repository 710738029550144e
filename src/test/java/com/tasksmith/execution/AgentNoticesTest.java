package com.tasksmith.execution;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class AgentNoticesTest {

    @Nested
    @DisplayName("fromPayload")
    class FromPayload {

        @Test
        @DisplayName("subagent invocation accepts either key style")
        void subagent() {
            var camel = AgentNotices.fromPayload(Map.of("kind", "subagent_invocation",
                    "subagentType", "reviewer", "description", "check the diff"));
            var snake = AgentNotices.fromPayload(Map.of("kind", "subagent_invocation", "subagent_type", "tester"));

            assertEquals(new AgentNotice.SubagentInvoked("reviewer", "check the diff"), camel);
            assertEquals(new AgentNotice.SubagentInvoked("tester", null), snake);
        }

        @Test
        @DisplayName("stage transitions require stage and status")
        void stage() {
            var notice = AgentNotices.fromPayload(Map.of("kind", "agent_stage", "stage", "implementation",
                    "status", "failed", "agentRole", "coder", "summary", "tests broke"));
            var missing = AgentNotices.fromPayload(Map.of("kind", "agent_stage", "stage", "implementation"));

            assertEquals(new AgentNotice.StageTransition("implementation", "coder", "failed", "tests broke"), notice);
            assertInstanceOf(AgentNotice.Unrecognized.class, missing);
        }

        @Test
        @DisplayName("review outcome reads a nested review and numeric strings")
        void review() {
            var notice = AgentNotices.fromPayload(Map.of("kind", "architecture_review", "iteration", "2",
                    "maxIterations", 3, "review", Map.of("status", "pass", "summary", "clean")));

            var review = assertInstanceOf(AgentNotice.ReviewOutcome.class, notice);
            assertEquals(2, review.iteration());
            assertEquals(3, review.maxIterations());
            assertTrue(review.passed());
            assertEquals("clean", review.summary());
        }

        @Test
        @DisplayName("long summaries are truncated")
        void truncates() {
            var notice = (AgentNotice.StageTransition) AgentNotices.fromPayload(Map.of("kind", "agent_stage",
                    "stage", "s", "status", "completed", "summary", "x".repeat(1000)));

            assertEquals(AgentNotices.MAX_SUMMARY_LENGTH, notice.summary().length());
        }

        @Test
        @DisplayName("unknown kinds and bad input never throw")
        void unknown() {
            var raw = new HashMap<String, Object>();
            raw.put("kind", "telemetry");
            raw.put("value", null);

            var notice = assertInstanceOf(AgentNotice.Unrecognized.class, AgentNotices.fromPayload(raw));
            assertEquals("telemetry", notice.kind());
            assertTrue(notice.raw().containsKey("value"));
            assertEquals("unknown", AgentNotices.fromPayload(null).kind());
            assertEquals("unknown", AgentNotices.fromPayload(Map.of("x", 1)).kind());
            assertInstanceOf(AgentNotice.Unrecognized.class,
                    AgentNotices.fromPayload(Map.of("kind", "architecture_review", "iteration", "two", "status", "pass")));
        }
    }

    @Test
    @DisplayName("payloads always carry kind and message")
    void toPayload() {
        Map<String, Object> payload = AgentNotices.toPayload(
                new AgentNotice.ReviewOutcome(1, 3, "blocked", "missing tests"));

        assertEquals("architecture_review", payload.get("kind"));
        assertEquals("Review iteration 1/3: blocked (missing tests)", payload.get("message"));
        assertEquals("blocked", payload.get("status"));

        Map<String, Object> unknown = AgentNotices.toPayload(new AgentNotice.Unrecognized("x", Map.of("a", 1)));
        assertEquals("Agent notice: x", unknown.get("message"));
        assertEquals(Map.of("a", 1), unknown.get("raw"));
    }

    @Test
    @DisplayName("describe reads naturally for each notice")
    void describe() {
        assertEquals("Subagent reviewer invoked: check",
                AgentNotices.describe(new AgentNotice.SubagentInvoked("reviewer", "check")));
        assertEquals("Subagent reviewer invoked.",
                AgentNotices.describe(new AgentNotice.SubagentInvoked("reviewer", null)));
        assertEquals("Stage build completed.",
                AgentNotices.describe(new AgentNotice.StageTransition("build", null, "completed", null)));
    }
}
