package com.reviewgate.change;

/**
 * Maximum list sizes the change data source returns before truncating.
 *
 * @param maxFiles   Modified-file listing cap
 * @param maxCommits Commit listing cap
 * @param maxReviews Review listing cap
 */
public record ChangeLimits(int maxFiles, int maxCommits, int maxReviews) {

    public static final int DEFAULT_MAX_FILES = 3000;
    public static final int DEFAULT_MAX_COMMITS = 250;
    public static final int DEFAULT_MAX_REVIEWS = 100;

    public static ChangeLimits defaults() {
        return new ChangeLimits(DEFAULT_MAX_FILES, DEFAULT_MAX_COMMITS, DEFAULT_MAX_REVIEWS);
    }
}
