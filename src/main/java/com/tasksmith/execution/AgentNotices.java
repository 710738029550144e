package com.tasksmith.execution;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Converts between {@link AgentNotice} and the loose maps agents and events carry.
 */
public final class AgentNotices {

    static final int MAX_SUMMARY_LENGTH = 400;

    private AgentNotices() {}

    /**
     * Validates a {@code kind}-tagged payload. Anything that does not match a known shape
     * becomes {@link AgentNotice.Unrecognized}; this method never throws for bad input.
     */
    public static AgentNotice fromPayload(Map<String, ?> payload) {
        if (payload == null) {
            return new AgentNotice.Unrecognized("unknown", Map.of());
        }
        String kind = text(payload.get("kind"));
        if (kind == null) {
            return unrecognized("unknown", payload);
        }
        switch (kind) {
            case AgentNotice.KIND_SUBAGENT -> {
                String type = text(payload.get("subagentType"));
                if (type == null) {
                    type = text(payload.get("subagent_type"));
                }
                if (type == null) {
                    return unrecognized(kind, payload);
                }
                return new AgentNotice.SubagentInvoked(type, text(payload.get("description")));
            }
            case AgentNotice.KIND_STAGE -> {
                String stage = text(payload.get("stage"));
                String status = text(payload.get("status"));
                if (stage == null || status == null) {
                    return unrecognized(kind, payload);
                }
                return new AgentNotice.StageTransition(stage, text(payload.get("agentRole")), status,
                        truncate(text(payload.get("summary"))));
            }
            case AgentNotice.KIND_REVIEW -> {
                Object reviewValue = payload.get("review");
                Map<?, ?> review = reviewValue instanceof Map<?, ?> m ? m : payload;
                String status = text(review.get("status"));
                Integer iteration = integer(payload.get("iteration"));
                if (status == null || iteration == null) {
                    return unrecognized(kind, payload);
                }
                Integer max = integer(payload.get("maxIterations"));
                return new AgentNotice.ReviewOutcome(iteration, max == null ? 0 : max, status,
                        truncate(text(review.get("summary"))));
            }
            default -> {
                return unrecognized(kind, payload);
            }
        }
    }

    /** Event payload for a notice; always carries {@code kind} and a display {@code message}. */
    public static Map<String, Object> toPayload(AgentNotice notice) {
        var payload = new LinkedHashMap<String, Object>();
        payload.put("kind", notice.kind());
        payload.put("message", describe(notice));
        if (notice instanceof AgentNotice.SubagentInvoked s) {
            payload.put("subagentType", s.subagentType());
            putIfPresent(payload, "description", s.description());
        } else if (notice instanceof AgentNotice.StageTransition s) {
            payload.put("stage", s.stage());
            putIfPresent(payload, "agentRole", s.agentRole());
            payload.put("status", s.status());
            putIfPresent(payload, "summary", s.summary());
        } else if (notice instanceof AgentNotice.ReviewOutcome r) {
            payload.put("iteration", r.iteration());
            payload.put("maxIterations", r.maxIterations());
            payload.put("status", r.status());
            putIfPresent(payload, "summary", r.summary());
        } else if (notice instanceof AgentNotice.Unrecognized u) {
            payload.put("raw", u.raw());
        }
        return payload;
    }

    public static String describe(AgentNotice notice) {
        if (notice instanceof AgentNotice.SubagentInvoked s) {
            return "Subagent " + s.subagentType() + " invoked"
                    + (s.description() != null ? ": " + s.description() : ".");
        } else if (notice instanceof AgentNotice.StageTransition s) {
            return "Stage " + s.stage() + " " + s.status() + ".";
        } else if (notice instanceof AgentNotice.ReviewOutcome r) {
            String of = r.maxIterations() > 0 ? "/" + r.maxIterations() : "";
            return "Review iteration " + r.iteration() + of + ": " + r.status()
                    + (r.summary() != null ? " (" + r.summary() + ")" : "");
        } else if (notice instanceof AgentNotice.Unrecognized u) {
            return "Agent notice: " + u.kind();
        }
        throw new IllegalStateException("Unhandled notice type: " + notice.getClass().getName());
    }

    private static AgentNotice unrecognized(String kind, Map<String, ?> payload) {
        return new AgentNotice.Unrecognized(kind, new LinkedHashMap<String, Object>(payload));
    }

    private static void putIfPresent(Map<String, Object> target, String key, Object value) {
        if (value != null) {
            target.put(key, value);
        }
    }

    private static String text(Object value) {
        if (value == null) {
            return null;
        }
        String s = value.toString().strip();
        return s.isEmpty() ? null : s;
    }

    private static Integer integer(Object value) {
        if (value instanceof Number n) {
            return n.intValue();
        }
        if (value instanceof String s) {
            try {
                return Integer.parseInt(s.strip());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    private static String truncate(String s) {
        if (s == null || s.length() <= MAX_SUMMARY_LENGTH) {
            return s;
        }
        return s.substring(0, MAX_SUMMARY_LENGTH);
    }
}
