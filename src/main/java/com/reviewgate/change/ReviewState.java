package com.reviewgate.change;

/**
 * State of a submitted pull request review.
 */
public enum ReviewState {
    APPROVED,
    CHANGES_REQUESTED,

    /**
     * Comment-only review; never changes the reviewer's recorded state.
     */
    COMMENTED,
    DISMISSED,
    PENDING;

    /**
     * Parse a state as reported by the hosting service, e.g. "changes_requested".
     */
    public static ReviewState parse(String value) {
        return ReviewState.valueOf(value.trim().toUpperCase().replace('-', '_').replace(' ', '_'));
    }
}
