package com.reviewgate.action;

import com.reviewgate.policy.EvaluationResult;

/**
 * Maps a verdict to the action taken on the pull request.
 * With review posting enabled the verdict is published as a review;
 * otherwise it only passes or fails the check.
 */
public class ReviewActionPlanner {

    private final boolean postReview;

    public ReviewActionPlanner(boolean postReview) {
        this.postReview = postReview;
    }

    public ReviewAction plan(EvaluationResult result) {
        if (result.isApproved()) {
            return postReview ? ReviewAction.APPROVE : ReviewAction.PASS;
        }
        return postReview ? ReviewAction.REQUEST_CHANGES : ReviewAction.FAIL;
    }
}
