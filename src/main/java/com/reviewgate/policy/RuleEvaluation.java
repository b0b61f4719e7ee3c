package com.reviewgate.policy;

import java.util.List;

/**
 * Per-rule results of one change, in rule declaration order.
 */
public record RuleEvaluation(List<RuleResult> results) {

    public RuleEvaluation {
        results = List.copyOf(results);
    }

    /**
     * True when every rule that matched a file passed.
     */
    public boolean isApproved() {
        return results.stream().allMatch(RuleResult::passed);
    }

    public List<RuleResult> failedRules() {
        return results.stream().filter(r -> !r.passed()).toList();
    }

    public List<String> diagnostics() {
        return failedRules().stream().map(RuleResult::diagnostic).toList();
    }
}
