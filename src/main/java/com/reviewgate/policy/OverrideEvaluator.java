package com.reviewgate.policy;

import com.reviewgate.config.OverrideCriteria;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Decides whether any override criteria waive unmet review requirements.
 * <p>
 * The overrides are alternatives: one satisfied entry is enough. Within an entry
 * every present clause must hold:
 * <ul>
 *   <li>{@code onlyModifiedByUsers}: each commit has a resolved author who is in the list</li>
 *   <li>{@code onlyModifiedFileRegExs}: each modified path contains a match for one of the patterns</li>
 * </ul>
 * An absent clause places no constraint.
 */
public class OverrideEvaluator {

    private static final Logger log = LoggerFactory.getLogger(OverrideEvaluator.class);

    /**
     * @return true if at least one override is satisfied
     */
    public boolean checkOverride(List<OverrideCriteria> overrides,
                                 List<String> modifiedFilePaths,
                                 List<String> committers) {
        return findOverride(overrides, modifiedFilePaths, committers).isPresent();
    }

    /**
     * Find the first satisfied override.
     *
     * @param overrides         Override criteria in declaration order
     * @param modifiedFilePaths Paths touched by the change
     * @param committers        Commit authors, null for an unresolved author
     * @return The first satisfied override, or empty if none is
     */
    public Optional<AppliedOverride> findOverride(List<OverrideCriteria> overrides,
                                                  List<String> modifiedFilePaths,
                                                  List<String> committers) {
        for (int i = 0; i < overrides.size(); i++) {
            OverrideCriteria criteria = overrides.get(i);
            if (isSatisfied(criteria, modifiedFilePaths, committers)) {
                AppliedOverride applied = new AppliedOverride(i, criteria);
                log.debug("Override satisfied: {}", applied);
                return Optional.of(applied);
            }
        }
        return Optional.empty();
    }

    boolean isSatisfied(OverrideCriteria criteria, List<String> modifiedFilePaths, List<String> committers) {
        boolean satisfied = true;
        if (criteria.hasUserClause()) {
            satisfied = onlyModifiedBy(criteria.onlyModifiedByUsers(), committers);
        }
        if (criteria.hasFileClause()) {
            satisfied = satisfied && onlyModifiedFilesMatching(criteria.filePatterns(), modifiedFilePaths);
        }
        return satisfied;
    }

    private static boolean onlyModifiedBy(List<String> allowedUsers, List<String> committers) {
        Set<String> allowed = new HashSet<>(allowedUsers);
        return committers.stream().allMatch(user -> user != null && allowed.contains(user));
    }

    private static boolean onlyModifiedFilesMatching(List<Pattern> patterns, List<String> modifiedFilePaths) {
        return modifiedFilePaths.stream()
                .allMatch(file -> patterns.stream().anyMatch(p -> p.matcher(file).find()));
    }
}
