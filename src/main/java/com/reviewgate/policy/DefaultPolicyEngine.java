package com.reviewgate.policy;

import com.reviewgate.change.ChangeSet;
import com.reviewgate.config.ReviewPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Default implementation of PolicyEngine.
 * Runs the rule evaluator and falls back to the override evaluator when a rule fails.
 */
public class DefaultPolicyEngine implements PolicyEngine {

    private static final Logger log = LoggerFactory.getLogger(DefaultPolicyEngine.class);

    private final RuleEvaluator ruleEvaluator;
    private final OverrideEvaluator overrideEvaluator;

    public DefaultPolicyEngine() {
        this(new RuleEvaluator(new ApproverResolver()), new OverrideEvaluator());
    }

    public DefaultPolicyEngine(RuleEvaluator ruleEvaluator, OverrideEvaluator overrideEvaluator) {
        this.ruleEvaluator = ruleEvaluator;
        this.overrideEvaluator = overrideEvaluator;
    }

    @Override
    public EvaluationResult evaluate(ReviewPolicy policy, ChangeSet change) {
        log.debug("Evaluating {} files against {} rules", change.modifiedFilePaths().size(), policy.reviewers().size());

        RuleEvaluation rules = ruleEvaluator.evaluate(
                policy.reviewers(), policy.teams(), change.modifiedFilePaths(), change.approvals());
        if (rules.isApproved()) {
            return DefaultEvaluationResult.approved(rules);
        }

        Optional<AppliedOverride> override = overrideEvaluator.findOverride(
                policy.overrides(), change.modifiedFilePaths(), change.committers());
        if (override.isPresent()) {
            log.info("Missing required approvals but allowing due to override: {}", override.get());
            return DefaultEvaluationResult.overridden(rules, override.get());
        }

        EvaluationResult result = DefaultEvaluationResult.rejected(rules);
        log.warn(result.getExplanation());
        return result;
    }
}
