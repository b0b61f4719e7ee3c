package com.reviewgate.change;

import java.util.Objects;

/**
 * A single review on a change.
 *
 * @param user  Login of the reviewer; null when the account no longer resolves
 * @param state Review state
 */
public record Review(String user, ReviewState state) {

    public Review {
        Objects.requireNonNull(state, "state");
    }

    public static Review approved(String user) {
        return new Review(user, ReviewState.APPROVED);
    }

    public static Review changesRequested(String user) {
        return new Review(user, ReviewState.CHANGES_REQUESTED);
    }

    public static Review commented(String user) {
        return new Review(user, ReviewState.COMMENTED);
    }
}
