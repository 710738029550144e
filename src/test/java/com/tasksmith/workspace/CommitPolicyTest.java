package com.tasksmith.workspace;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CommitPolicyTest {

    private CommitPolicy policy;

    @BeforeEach
    void setUp() {
        policy = new CommitPolicy(new GitProperties());
    }

    private static CommitRecord commit(String subject, String body) {
        return new CommitRecord("0123456789abcdef", subject, body);
    }

    @ParameterizedTest
    @ValueSource(strings = {"feat: add login", "fix(api): handle null", "refactor!: drop v1", "chore(deps)!: bump"})
    void acceptsConventionalHeaders(String subject) {
        assertTrue(policy.isConventionalHeader(subject));
    }

    @ParameterizedTest
    @ValueSource(strings = {"Add login", "feat add login", "Feat: add login", "feat:", ""})
    void rejectsOtherHeaders(String subject) {
        assertFalse(policy.isConventionalHeader(subject));
    }

    @Test
    @DisplayName("an empty branch is a violation")
    void noCommits() {
        var ex = assertThrows(PolicyViolationException.class, () -> policy.validate(List.of(), "task setup"));
        assertEquals("No commits found in task setup.", ex.getMessage());
    }

    @Test
    @DisplayName("a non-conventional subject names the short hash")
    void badSubject() {
        var ex = assertThrows(PolicyViolationException.class, () -> policy.validate(
                List.of(commit("feat: ok", "feat: ok"), commit("wip", "wip")), "task setup"));

        assertEquals("Commit policy violation in task setup: commit 01234567 is not Conventional Commit compliant.",
                ex.getMessage());
    }

    @Test
    @DisplayName("a forbidden co-author trailer is rejected")
    void forbiddenTrailer() {
        var ex = assertThrows(PolicyViolationException.class, () -> policy.validate(
                List.of(commit("feat: x", "feat: x\n\nCo-Authored-By: Claude <noreply@anthropic.com>")), "task a"));

        assertTrue(ex.getMessage().contains("forbidden co-author trailer"));
    }

    @Test
    @DisplayName("other trailers are allowed")
    void otherTrailers() {
        assertDoesNotThrow(() -> policy.validate(
                List.of(commit("feat: x", "feat: x\n\nCo-authored-by: Jane Doe <jane@example.com>")), "task a"));
    }
}
