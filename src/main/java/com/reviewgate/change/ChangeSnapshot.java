package com.reviewgate.change;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Raw listings gathered for a change before approvals are derived.
 *
 * @param files      Modified file paths
 * @param reviews    Reviews in chronological order
 * @param committers Commit authors; null entries for unresolved authors
 */
public record ChangeSnapshot(
        List<String> files,
        List<Review> reviews,
        List<String> committers
) {
    public ChangeSnapshot {
        files = files == null ? List.of() : List.copyOf(files);
        reviews = reviews == null ? List.of() : List.copyOf(reviews);
        committers = committers == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(committers));
    }

    /**
     * Reduce the raw listings to the evaluation input.
     */
    public ChangeSet toChangeSet() {
        return new ChangeSet(files, ApprovalCollector.collect(reviews), committers);
    }
}
