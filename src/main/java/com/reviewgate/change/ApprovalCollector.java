package com.reviewgate.change;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Derives the set of approving users from a chronological review list.
 * <p>
 * Only each reviewer's latest non-comment review counts: a later
 * {@code CHANGES_REQUESTED} cancels an earlier approval and vice versa.
 */
public final class ApprovalCollector {

    private ApprovalCollector() {
    }

    /**
     * @param reviews Reviews in the order they were submitted
     * @return Users whose latest significant review is an approval, in first-seen order
     */
    public static Set<String> collect(List<Review> reviews) {
        Map<String, ReviewState> latestState = new LinkedHashMap<>();
        for (Review review : reviews) {
            if (review.user() != null && review.state() != ReviewState.COMMENTED) {
                latestState.put(review.user(), review.state());
            }
        }

        Set<String> approvals = new LinkedHashSet<>();
        latestState.forEach((user, state) -> {
            if (state == ReviewState.APPROVED) {
                approvals.add(user);
            }
        });
        return Collections.unmodifiableSet(approvals);
    }
}
