package com.reviewgate.config;

import com.reviewgate.exception.ConfigurationException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Root of a reviewer policy document.
 * <p>
 * Construction validates that every team referenced by a rule is defined,
 * so an instance is always safe to evaluate.
 *
 * @param teams     Team name to team definition; empty when the document has none
 * @param reviewers Path prefix to review requirement, in declaration order
 * @param overrides Criteria that waive unmet requirements, in declaration order
 */
public record ReviewPolicy(
        Map<String, TeamConfig> teams,
        Map<String, ReviewerRule> reviewers,
        List<OverrideCriteria> overrides
) {
    public ReviewPolicy {
        if (reviewers == null) {
            throw new ConfigurationException("Review policy must define 'reviewers'");
        }
        teams = teams == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(teams));
        reviewers = Collections.unmodifiableMap(new LinkedHashMap<>(reviewers));
        overrides = overrides == null ? List.of() : List.copyOf(overrides);

        for (Map.Entry<String, ReviewerRule> entry : reviewers.entrySet()) {
            for (String team : entry.getValue().teams()) {
                if (!teams.containsKey(team)) {
                    throw new ConfigurationException("Rule '" + entry.getKey()
                            + "' references undefined team '" + team + "'. Define it under teams.");
                }
            }
        }
    }

    public Optional<TeamConfig> team(String name) {
        return Optional.ofNullable(teams.get(name));
    }

    /**
     * Create a policy with rules only.
     */
    public static ReviewPolicy of(Map<String, ReviewerRule> reviewers) {
        return new ReviewPolicy(null, reviewers, null);
    }
}
