package com.tasksmith.execution;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Structured side-channel notices an agent reports while it works.
 * Loose, {@code kind}-tagged payloads are converted by {@link AgentNotices#fromPayload(Map)}.
 */
public sealed interface AgentNotice
        permits AgentNotice.SubagentInvoked, AgentNotice.StageTransition,
                AgentNotice.ReviewOutcome, AgentNotice.Unrecognized {

    String KIND_SUBAGENT = "subagent_invocation";
    String KIND_STAGE = "agent_stage";
    String KIND_REVIEW = "architecture_review";

    String kind();

    /**
     * The agent delegated part of the work to a sub-agent.
     */
    record SubagentInvoked(String subagentType, String description) implements AgentNotice {
        @Override
        public String kind() {
            return KIND_SUBAGENT;
        }
    }

    /**
     * A pipeline stage started, completed or failed.
     *
     * @param stage     stage name, e.g. "implementation"
     * @param agentRole role running the stage, or null
     * @param status    "started", "completed" or "failed"
     * @param summary   short summary, at most a few hundred chars
     */
    record StageTransition(String stage, String agentRole, String status, String summary) implements AgentNotice {
        @Override
        public String kind() {
            return KIND_STAGE;
        }
    }

    /**
     * Result of one review iteration.
     *
     * @param status "pass", "pass_with_notes", "changes_required" or "blocked"
     */
    record ReviewOutcome(int iteration, int maxIterations, String status, String summary) implements AgentNotice {
        @Override
        public String kind() {
            return KIND_REVIEW;
        }

        public boolean passed() {
            return "pass".equals(status);
        }
    }

    /**
     * A payload whose kind is unknown or whose fields did not validate. Kept so nothing is lost.
     */
    record Unrecognized(String kind, Map<String, Object> raw) implements AgentNotice {
        public Unrecognized {
            raw = raw == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(raw));
        }
    }
}
