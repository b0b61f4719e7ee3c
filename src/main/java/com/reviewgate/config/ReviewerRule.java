package com.reviewgate.config;

import com.reviewgate.exception.ConfigurationException;

import java.util.List;

/**
 * Review requirement attached to a path prefix.
 *
 * @param description           Optional human-readable description
 * @param users                 Individually named approvers
 * @param teams                 Names of teams whose members may approve
 * @param requiredApproverCount Minimum number of distinct approvals from users or team members
 */
public record ReviewerRule(
        String description,
        List<String> users,
        List<String> teams,
        int requiredApproverCount
) {
    public ReviewerRule {
        users = users == null ? List.of() : List.copyOf(users);
        teams = teams == null ? List.of() : List.copyOf(teams);
        if (requiredApproverCount < 0) {
            throw new ConfigurationException(
                    "requiredApproverCount must not be negative, got " + requiredApproverCount);
        }
    }

    /**
     * Create a rule satisfied by approvals from the named users.
     */
    public static ReviewerRule ofUsers(int requiredApproverCount, String... users) {
        return new ReviewerRule(null, List.of(users), List.of(), requiredApproverCount);
    }

    /**
     * Create a rule satisfied by approvals from members of the named teams.
     */
    public static ReviewerRule ofTeams(int requiredApproverCount, String... teams) {
        return new ReviewerRule(null, List.of(), List.of(teams), requiredApproverCount);
    }
}
