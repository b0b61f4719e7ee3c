package com.reviewgate.config;

import com.reviewgate.exception.ConfigurationException;

import java.util.List;

/**
 * A named group of users that rules can reference.
 *
 * @param description Optional human-readable description
 * @param users       Team members as declared; treated as a set by every consumer
 */
public record TeamConfig(
        String description,
        List<String> users
) {
    public TeamConfig {
        users = users == null ? List.of() : List.copyOf(users);
        for (String user : users) {
            if (user.isBlank()) {
                throw new ConfigurationException("Team members must be non-empty user identifiers");
            }
        }
    }

    /**
     * Create a team without a description.
     */
    public static TeamConfig of(String... users) {
        return new TeamConfig(null, List.of(users));
    }
}
