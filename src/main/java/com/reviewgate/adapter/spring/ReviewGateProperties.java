package com.reviewgate.adapter.spring;

import com.reviewgate.change.ChangeLimits;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Spring Boot configuration properties for the review gate.
 */
@ConfigurationProperties(prefix = "review-gate")
public class ReviewGateProperties {

    /**
     * Whether the review gate is enabled.
     */
    private boolean enabled = true;

    /**
     * Path to the reviewer policy document.
     * Supports classpath: prefix for classpath resources.
     */
    private String configPath = ".github/reviewers.json";

    /**
     * Path to the JSON snapshot of the change under evaluation.
     */
    private String changePath;

    /**
     * Publish the verdict as a review instead of failing the check.
     */
    private boolean postReview = false;

    private final Limits limits = new Limits();

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getConfigPath() {
        return configPath;
    }

    public void setConfigPath(String configPath) {
        this.configPath = configPath;
    }

    public String getChangePath() {
        return changePath;
    }

    public void setChangePath(String changePath) {
        this.changePath = changePath;
    }

    public boolean isPostReview() {
        return postReview;
    }

    public void setPostReview(boolean postReview) {
        this.postReview = postReview;
    }

    public Limits getLimits() {
        return limits;
    }

    /**
     * Listing caps of the change data source; reaching one logs a truncation warning.
     */
    public static class Limits {

        private int maxFiles = ChangeLimits.DEFAULT_MAX_FILES;
        private int maxCommits = ChangeLimits.DEFAULT_MAX_COMMITS;
        private int maxReviews = ChangeLimits.DEFAULT_MAX_REVIEWS;

        public int getMaxFiles() {
            return maxFiles;
        }

        public void setMaxFiles(int maxFiles) {
            this.maxFiles = maxFiles;
        }

        public int getMaxCommits() {
            return maxCommits;
        }

        public void setMaxCommits(int maxCommits) {
            this.maxCommits = maxCommits;
        }

        public int getMaxReviews() {
            return maxReviews;
        }

        public void setMaxReviews(int maxReviews) {
            this.maxReviews = maxReviews;
        }

        public ChangeLimits toChangeLimits() {
            return new ChangeLimits(maxFiles, maxCommits, maxReviews);
        }
    }
}
