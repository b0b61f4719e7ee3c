package com.reviewgate.action;

/**
 * What the caller should do with a verdict.
 */
public enum ReviewAction {

    /**
     * Post an approving review.
     */
    APPROVE(true, true, "All review requirements have been met"),

    /**
     * Let the check pass without posting a review.
     */
    PASS(true, false, "All review requirements have been met"),

    /**
     * Post a review requesting changes.
     */
    REQUEST_CHANGES(false, true, "Missing required reviewers"),

    /**
     * Fail the check.
     */
    FAIL(false, false, "Missing required approvals.");

    private final boolean approving;
    private final boolean postsReview;
    private final String message;

    ReviewAction(boolean approving, boolean postsReview, String message) {
        this.approving = approving;
        this.postsReview = postsReview;
        this.message = message;
    }

    public boolean isApproving() {
        return approving;
    }

    public boolean postsReview() {
        return postsReview;
    }

    /**
     * Review body or check failure message.
     */
    public String getMessage() {
        return message;
    }
}
