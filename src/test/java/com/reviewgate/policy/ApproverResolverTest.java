package com.reviewgate.policy;

import com.reviewgate.config.ReviewerRule;
import com.reviewgate.config.TeamConfig;
import com.reviewgate.exception.ConfigurationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ApproverResolver.
 */
class ApproverResolverTest {

    private final ApproverResolver resolver = new ApproverResolver();

    private final Map<String, TeamConfig> teams = Map.of(
            "core-team", TeamConfig.of("carol", "dave"),
            "infra", TeamConfig.of("dave", "frank"));

    @Test
    @DisplayName("Named users alone form the approver set")
    void usersOnly() {
        Set<String> approvers = resolver.resolvePossibleApprovers(ReviewerRule.ofUsers(1, "alice", "bob"), teams);

        assertEquals(Set.of("alice", "bob"), approvers);
    }

    @Test
    @DisplayName("Team members are added to named users")
    void usersAndTeams() {
        ReviewerRule rule = new ReviewerRule(null, List.of("alice"), List.of("core-team"), 1);

        assertEquals(Set.of("alice", "carol", "dave"), resolver.resolvePossibleApprovers(rule, teams));
    }

    @Test
    @DisplayName("Duplicates across users and overlapping teams collapse")
    void duplicatesCollapse() {
        ReviewerRule rule = new ReviewerRule(null, List.of("dave", "dave", "carol"), List.of("core-team", "infra"), 1);

        Set<String> approvers = resolver.resolvePossibleApprovers(rule, teams);

        assertEquals(Set.of("carol", "dave", "frank"), approvers);
        assertEquals(3, approvers.size());
    }

    @Test
    @DisplayName("Rule without users or teams has no possible approvers")
    void emptyRule() {
        assertTrue(resolver.resolvePossibleApprovers(ReviewerRule.ofUsers(0), teams).isEmpty());
    }

    @Test
    @DisplayName("Undefined team fails instead of being treated as empty")
    void undefinedTeamFails() {
        ReviewerRule rule = new ReviewerRule("Runtime", List.of("alice"), List.of("missing-team"), 1);

        ConfigurationException e = assertThrows(ConfigurationException.class,
                () -> resolver.resolvePossibleApprovers(rule, teams));
        assertTrue(e.getMessage().contains("missing-team"));
        assertTrue(e.getMessage().contains("Runtime"));
    }
}
