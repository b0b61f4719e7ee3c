package com.reviewgate.policy;

import com.reviewgate.config.ReviewerRule;
import com.reviewgate.config.TeamConfig;
import com.reviewgate.exception.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Checks every path-prefix rule against the modified files and approvals of a change.
 * <p>
 * A rule applies when at least one modified path starts with its prefix (a literal
 * string prefix, so {@code src/f} matches {@code src/foo}). An applicable rule passes
 * when the approvals include at least {@code requiredApproverCount} of its possible
 * approvers. Rules that match no file never block approval.
 */
public class RuleEvaluator {

    private static final Logger log = LoggerFactory.getLogger(RuleEvaluator.class);

    private final ApproverResolver approverResolver;

    public RuleEvaluator(ApproverResolver approverResolver) {
        this.approverResolver = approverResolver;
    }

    /**
     * Evaluate all rules in declaration order.
     *
     * @param reviewers         Path prefix to rule
     * @param teams             Team roster used to resolve approvers
     * @param modifiedFilePaths Paths touched by the change
     * @param approvals         Users currently approving the change
     * @return Result of each rule, in the order of {@code reviewers}
     */
    public RuleEvaluation evaluate(Map<String, ReviewerRule> reviewers,
                                   Map<String, TeamConfig> teams,
                                   List<String> modifiedFilePaths,
                                   Collection<String> approvals) {
        List<RuleResult> results = new ArrayList<>(reviewers.size());
        for (Map.Entry<String, ReviewerRule> entry : reviewers.entrySet()) {
            results.add(evaluateRule(entry.getKey(), entry.getValue(), teams, modifiedFilePaths, approvals));
        }
        return new RuleEvaluation(results);
    }

    RuleResult evaluateRule(String prefix, ReviewerRule rule, Map<String, TeamConfig> teams,
                            List<String> modifiedFilePaths, Collection<String> approvals) {
        List<String> affectedFiles = modifiedFilePaths.stream()
                .filter(file -> file.startsWith(prefix))
                .toList();
        if (affectedFiles.isEmpty()) {
            return RuleResult.unmatched(prefix, rule);
        }

        Set<String> possibleApprovers;
        try {
            possibleApprovers = approverResolver.resolvePossibleApprovers(rule, teams);
        } catch (ConfigurationException e) {
            throw new ConfigurationException("Rule '" + prefix + "': " + e.getMessage(), e);
        }
        List<String> relevantApprovals = approvals.stream()
                .filter(possibleApprovers::contains)
                .distinct()
                .toList();

        if (relevantApprovals.size() < rule.requiredApproverCount()) {
            String diagnostic = describeFailure(rule, affectedFiles, relevantApprovals);
            log.warn(diagnostic);
            return RuleResult.failed(prefix, rule, affectedFiles, relevantApprovals, diagnostic);
        }
        log.info("{} review requirements met.", prefix);
        return RuleResult.satisfied(prefix, rule, affectedFiles, relevantApprovals);
    }

    static String describeFailure(ReviewerRule rule, List<String> affectedFiles, List<String> relevantApprovals) {
        StringBuilder sb = new StringBuilder("Modified Files:\n");
        affectedFiles.forEach(f -> sb.append(" - ").append(f).append('\n'));
        sb.append("Require ").append(rule.requiredApproverCount()).append(" reviews from:\n");
        appendList(sb, "users", rule.users());
        appendList(sb, "teams", rule.teams());
        sb.append("But only found ").append(relevantApprovals.size()).append(" approvals: [")
                .append(String.join(", ", relevantApprovals)).append("].");
        return sb.toString();
    }

    private static void appendList(StringBuilder sb, String label, List<String> values) {
        sb.append("  ").append(label).append(':');
        if (values.isEmpty()) {
            sb.append(" []\n");
            return;
        }
        sb.append('\n');
        values.forEach(v -> sb.append(" - ").append(v).append('\n'));
    }
}
