package com.reviewgate.policy;

import com.reviewgate.change.ChangeSet;
import com.reviewgate.config.ReviewPolicy;

/**
 * Decides whether a change satisfies a review policy.
 * Implementations are stateless and safe to call concurrently for independent changes.
 */
public interface PolicyEngine {

    /**
     * Evaluate the policy's rules against the change, then its overrides if any rule failed.
     *
     * @param policy Validated review policy
     * @param change Files, approvals and committers of the change
     * @return Verdict with per-rule results
     * @throws com.reviewgate.exception.ConfigurationException if a rule references an undefined team
     */
    EvaluationResult evaluate(ReviewPolicy policy, ChangeSet change);
}
