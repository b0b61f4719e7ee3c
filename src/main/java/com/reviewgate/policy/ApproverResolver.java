package com.reviewgate.policy;

import com.reviewgate.config.ReviewerRule;
import com.reviewgate.config.TeamConfig;
import com.reviewgate.exception.ConfigurationException;

import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Expands a rule's named users and teams into the flat set of users allowed to approve.
 */
public class ApproverResolver {

    /**
     * Resolve the possible approvers of a rule.
     *
     * @param rule  Rule whose users and teams are expanded
     * @param teams Team roster of the policy
     * @return Union of the rule's users and the members of each named team
     * @throws ConfigurationException if the rule names a team missing from the roster
     */
    public Set<String> resolvePossibleApprovers(ReviewerRule rule, Map<String, TeamConfig> teams) {
        Set<String> approvers = new LinkedHashSet<>(rule.users());
        for (String teamName : rule.teams()) {
            TeamConfig team = teams.get(teamName);
            if (team == null) {
                throw new ConfigurationException("Undefined team '" + teamName + "' referenced by rule"
                        + (rule.description() != null ? " '" + rule.description() + "'" : ""));
            }
            approvers.addAll(team.users());
        }
        return approvers;
    }
}
