package com.reviewgate.policy;

import java.util.List;
import java.util.Optional;

/**
 * Result of evaluating a change against a review policy.
 * A rejected change is a normal result, not an error.
 */
public interface EvaluationResult {

    /**
     * Final verdict, after overrides.
     */
    boolean isApproved();

    /**
     * Whether every matched rule passed on its own, without an override.
     */
    boolean isRulesSatisfied();

    /**
     * Get the result of every rule, in declaration order.
     */
    List<RuleResult> getRuleResults();

    /**
     * Get the rules that matched a file but lacked approvals.
     */
    List<RuleResult> getFailedRules();

    /**
     * Get the override that waived failed rules, if one was used.
     */
    Optional<AppliedOverride> getAppliedOverride();

    /**
     * Get human-readable explanation of the verdict.
     */
    String getExplanation();
}
