package com.reviewgate.policy;

import com.reviewgate.config.OverrideCriteria;

/**
 * The override that waived a failed evaluation.
 *
 * @param index    Position of the override in the policy's override list
 * @param criteria The satisfied override
 */
public record AppliedOverride(int index, OverrideCriteria criteria) {

    public String description() {
        return criteria.description();
    }

    @Override
    public String toString() {
        return "override #" + index + (criteria.description() != null ? " (" + criteria.description() + ")" : "");
    }
}
