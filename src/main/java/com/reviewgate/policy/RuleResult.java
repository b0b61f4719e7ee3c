package com.reviewgate.policy;

import com.reviewgate.config.ReviewerRule;

import java.util.List;

/**
 * Outcome of evaluating one rule against a change.
 *
 * @param prefix            Path prefix of the rule
 * @param rule              The evaluated rule
 * @param matched           Whether any modified file starts with the prefix
 * @param passed            Whether the rule is satisfied; always true when unmatched
 * @param affectedFiles     Modified files starting with the prefix
 * @param relevantApprovals Approvals from users in the rule's approver set
 * @param diagnostic        Explanation of the failure; null when passed
 */
public record RuleResult(
        String prefix,
        ReviewerRule rule,
        boolean matched,
        boolean passed,
        List<String> affectedFiles,
        List<String> relevantApprovals,
        String diagnostic
) {
    public RuleResult {
        affectedFiles = List.copyOf(affectedFiles);
        relevantApprovals = List.copyOf(relevantApprovals);
    }

    static RuleResult unmatched(String prefix, ReviewerRule rule) {
        return new RuleResult(prefix, rule, false, true, List.of(), List.of(), null);
    }

    static RuleResult satisfied(String prefix, ReviewerRule rule,
                                List<String> affectedFiles, List<String> relevantApprovals) {
        return new RuleResult(prefix, rule, true, true, affectedFiles, relevantApprovals, null);
    }

    static RuleResult failed(String prefix, ReviewerRule rule,
                             List<String> affectedFiles, List<String> relevantApprovals, String diagnostic) {
        return new RuleResult(prefix, rule, true, false, affectedFiles, relevantApprovals, diagnostic);
    }

    @Override
    public String toString() {
        if (!matched) {
            return prefix + ": not matched";
        }
        return prefix + ": " + (passed ? "passed" : "failed") + " ("
                + relevantApprovals.size() + "/" + rule.requiredApproverCount() + " approvals)";
    }
}
