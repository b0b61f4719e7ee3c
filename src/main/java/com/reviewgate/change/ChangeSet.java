package com.reviewgate.change;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Immutable snapshot of the change under evaluation.
 *
 * @param modifiedFilePaths Repository-relative paths touched by the change, as listed
 * @param approvals         Users whose latest review approves the change
 * @param committers        Author of each commit; an entry is null when the author
 *                          could not be resolved to a user
 */
public record ChangeSet(
        List<String> modifiedFilePaths,
        Set<String> approvals,
        List<String> committers
) {
    public ChangeSet {
        modifiedFilePaths = modifiedFilePaths == null ? List.of() : List.copyOf(modifiedFilePaths);
        approvals = approvals == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(approvals));
        // committers may hold nulls, so List.copyOf is not an option
        committers = committers == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(committers));
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for {@link ChangeSet}.
     */
    public static class Builder {
        private final List<String> modifiedFilePaths = new ArrayList<>();
        private final Set<String> approvals = new LinkedHashSet<>();
        private final List<String> committers = new ArrayList<>();

        public Builder files(String... paths) {
            modifiedFilePaths.addAll(Arrays.asList(paths));
            return this;
        }

        public Builder approvals(String... users) {
            approvals.addAll(Arrays.asList(users));
            return this;
        }

        /**
         * Add commit authors; pass null for a commit whose author is unresolved.
         */
        public Builder committers(String... users) {
            committers.addAll(Arrays.asList(users));
            return this;
        }

        public ChangeSet build() {
            return new ChangeSet(modifiedFilePaths, approvals, committers);
        }
    }
}
