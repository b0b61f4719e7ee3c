package com.reviewgate.config;

import com.reviewgate.exception.ConfigurationException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Criteria under which unmet review requirements are waived.
 * A null clause is absent and does not constrain the override; an override
 * with no clauses at all always applies.
 * <p>
 * File patterns are compiled once, on construction.
 */
public final class OverrideCriteria {

    private final String description;
    private final List<String> onlyModifiedByUsers;
    private final List<String> onlyModifiedFileRegExs;
    private final List<Pattern> filePatterns;

    /**
     * @param description            Optional human-readable description
     * @param onlyModifiedByUsers    If present, every commit must come from one of these users
     * @param onlyModifiedFileRegExs If present, every modified path must match one of these patterns
     * @throws ConfigurationException if a file pattern is not a valid regular expression
     */
    public OverrideCriteria(String description,
                            List<String> onlyModifiedByUsers,
                            List<String> onlyModifiedFileRegExs) {
        this.description = description;
        this.onlyModifiedByUsers = onlyModifiedByUsers == null ? null : List.copyOf(onlyModifiedByUsers);
        this.onlyModifiedFileRegExs = onlyModifiedFileRegExs == null ? null : List.copyOf(onlyModifiedFileRegExs);
        this.filePatterns = this.onlyModifiedFileRegExs == null ? List.of() : compile(this.onlyModifiedFileRegExs);
    }

    public String description() {
        return description;
    }

    public List<String> onlyModifiedByUsers() {
        return onlyModifiedByUsers;
    }

    public List<String> onlyModifiedFileRegExs() {
        return onlyModifiedFileRegExs;
    }

    public boolean hasUserClause() {
        return onlyModifiedByUsers != null;
    }

    public boolean hasFileClause() {
        return onlyModifiedFileRegExs != null;
    }

    /**
     * Compiled form of {@link #onlyModifiedFileRegExs()}; empty when the clause is absent.
     */
    public List<Pattern> filePatterns() {
        return filePatterns;
    }

    /**
     * Create an override that applies when only the given users committed.
     */
    public static OverrideCriteria onlyModifiedBy(String... users) {
        return new OverrideCriteria(null, List.of(users), null);
    }

    /**
     * Create an override that applies when every modified file matches one of the patterns.
     */
    public static OverrideCriteria onlyModifiedFiles(String... regexes) {
        return new OverrideCriteria(null, null, List.of(regexes));
    }

    private static List<Pattern> compile(List<String> regexes) {
        List<Pattern> patterns = new ArrayList<>(regexes.size());
        for (String regex : regexes) {
            try {
                patterns.add(Pattern.compile(regex));
            } catch (PatternSyntaxException e) {
                throw new ConfigurationException("Invalid override file pattern '" + regex + "'", e);
            }
        }
        return Collections.unmodifiableList(patterns);
    }

    // Pattern has identity equality, so equality is defined on the source strings
    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof OverrideCriteria that)) {
            return false;
        }
        return Objects.equals(description, that.description)
                && Objects.equals(onlyModifiedByUsers, that.onlyModifiedByUsers)
                && Objects.equals(onlyModifiedFileRegExs, that.onlyModifiedFileRegExs);
    }

    @Override
    public int hashCode() {
        return Objects.hash(description, onlyModifiedByUsers, onlyModifiedFileRegExs);
    }

    @Override
    public String toString() {
        return "OverrideCriteria[description=" + description
                + ", onlyModifiedByUsers=" + onlyModifiedByUsers
                + ", onlyModifiedFileRegExs=" + onlyModifiedFileRegExs + "]";
    }
}
