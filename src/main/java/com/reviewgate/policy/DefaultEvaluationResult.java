package com.reviewgate.policy;

import java.util.List;
import java.util.Optional;

/**
 * Default implementation of EvaluationResult.
 */
public class DefaultEvaluationResult implements EvaluationResult {

    private final RuleEvaluation ruleEvaluation;
    private final AppliedOverride appliedOverride;
    private final boolean approved;
    private final String explanation;

    private DefaultEvaluationResult(RuleEvaluation ruleEvaluation, AppliedOverride appliedOverride,
                                    boolean approved, String explanation) {
        this.ruleEvaluation = ruleEvaluation;
        this.appliedOverride = appliedOverride;
        this.approved = approved;
        this.explanation = explanation;
    }

    @Override
    public boolean isApproved() {
        return approved;
    }

    @Override
    public boolean isRulesSatisfied() {
        return ruleEvaluation.isApproved();
    }

    @Override
    public List<RuleResult> getRuleResults() {
        return ruleEvaluation.results();
    }

    @Override
    public List<RuleResult> getFailedRules() {
        return ruleEvaluation.failedRules();
    }

    @Override
    public Optional<AppliedOverride> getAppliedOverride() {
        return Optional.ofNullable(appliedOverride);
    }

    @Override
    public String getExplanation() {
        return explanation;
    }

    @Override
    public String toString() {
        return "EvaluationResult{" +
                "approved=" + approved +
                ", failedRules=" + getFailedRules().stream().map(RuleResult::prefix).toList() +
                ", override=" + (appliedOverride != null ? appliedOverride : "none") +
                '}';
    }

    /**
     * Create a result for a change whose rules all passed.
     */
    public static EvaluationResult approved(RuleEvaluation ruleEvaluation) {
        return new DefaultEvaluationResult(ruleEvaluation, null, true,
                "All review requirements have been met");
    }

    /**
     * Create a result for a change approved by an override despite failed rules.
     */
    public static EvaluationResult overridden(RuleEvaluation ruleEvaluation, AppliedOverride override) {
        return new DefaultEvaluationResult(ruleEvaluation, override, true,
                "Missing required approvals but allowing due to " + override);
    }

    /**
     * Create a result for a change missing required approvals.
     */
    public static EvaluationResult rejected(RuleEvaluation ruleEvaluation) {
        return new DefaultEvaluationResult(ruleEvaluation, null, false,
                "Missing required approvals for: " + String.join(", ",
                        ruleEvaluation.failedRules().stream().map(RuleResult::prefix).toList()));
    }
}
