package com.reviewgate.change;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Flags change listings that reached their data source cap.
 * <p>
 * A listing at its cap may have been cut short, in which case the verdict was
 * computed over partial data. Evaluation still proceeds; the warnings are
 * reported alongside the verdict.
 */
public final class TruncationCheck {

    private static final Logger log = LoggerFactory.getLogger(TruncationCheck.class);

    private TruncationCheck() {
    }

    /**
     * @return One warning per listing that may be truncated; empty when all are below their caps
     */
    public static List<String> check(ChangeSnapshot snapshot, ChangeLimits limits) {
        List<String> warnings = new ArrayList<>();
        addIfAtCap(warnings, "modified files", snapshot.files().size(), limits.maxFiles());
        addIfAtCap(warnings, "commits", snapshot.committers().size(), limits.maxCommits());
        addIfAtCap(warnings, "reviews", snapshot.reviews().size(), limits.maxReviews());
        warnings.forEach(log::warn);
        return warnings;
    }

    private static void addIfAtCap(List<String> warnings, String listing, int size, int cap) {
        if (cap > 0 && size >= cap) {
            warnings.add("Listed " + size + " " + listing + ", the data source limit is " + cap
                    + "; the list may be truncated and the verdict based on partial data");
        }
    }
}
