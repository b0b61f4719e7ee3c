package com.reviewgate.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.StreamReadFeature;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.reviewgate.exception.ConfigurationException;
import com.reviewgate.exception.InputUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Loads reviewer policies from JSON or YAML documents.
 * <p>
 * JSON is the canonical format ({@code .github/reviewers.json}); files ending in
 * {@code .yaml} or {@code .yml} are read as YAML. Both are decoded to a plain map
 * and then validated into a {@link ReviewPolicy}.
 */
public class PolicyLoader {

    private static final Logger log = LoggerFactory.getLogger(PolicyLoader.class);

    // Team names and rule prefixes must be unique; a repeated key is an error, not an override
    private static final ObjectMapper objectMapper = JsonMapper.builder()
            .enable(StreamReadFeature.STRICT_DUPLICATE_DETECTION)
            .build();

    /**
     * Load a policy from a path.
     * Supports classpath: prefix for classpath resources.
     *
     * @param path Path to the policy document
     * @return Validated policy
     * @throws InputUnavailableException if the document does not exist or cannot be read
     * @throws ConfigurationException    if the document is not a valid policy
     */
    public static ReviewPolicy load(String path) {
        log.info("Loading review policy from: {}", path);

        Resource resource = getResource(path);
        if (!resource.exists()) {
            throw new InputUnavailableException("Unable to retrieve " + path);
        }
        try (InputStream inputStream = resource.getInputStream()) {
            Map<String, Object> root = isYaml(path) ? readYaml(inputStream) : readJson(inputStream);
            ReviewPolicy policy = parse(root);
            log.info("Loaded review policy from {}: {} teams, {} rules, {} overrides",
                    path, policy.teams().size(), policy.reviewers().size(), policy.overrides().size());
            return policy;
        } catch (IOException e) {
            throw new InputUnavailableException("Failed to read review policy from: " + path, e);
        }
    }

    /**
     * Parse a policy from a JSON string.
     */
    public static ReviewPolicy parseJson(String json) {
        try {
            return parse(objectMapper.readValue(json, new TypeReference<Map<String, Object>>() {}));
        } catch (JsonProcessingException e) {
            throw new ConfigurationException("Review policy is not valid JSON: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Validate a decoded policy document.
     */
    public static ReviewPolicy parse(Map<String, Object> root) {
        if (root == null) {
            throw new ConfigurationException("Review policy is empty");
        }
        if (!root.containsKey("reviewers")) {
            throw new ConfigurationException("Review policy must define 'reviewers'");
        }

        Map<String, TeamConfig> teams = parseTeams(getMap(root, "teams", "teams"));
        Map<String, ReviewerRule> reviewers = parseReviewers(getMap(root, "reviewers", "reviewers"));
        List<OverrideCriteria> overrides = parseOverrides(root.get("overrides"));

        return new ReviewPolicy(teams, reviewers, overrides);
    }

    private static Resource getResource(String path) {
        if (path.startsWith("classpath:")) {
            String resourcePath = path.substring("classpath:".length());
            return new ClassPathResource(resourcePath);
        }
        return new FileSystemResource(path);
    }

    private static boolean isYaml(String path) {
        String lower = path.toLowerCase();
        return lower.endsWith(".yaml") || lower.endsWith(".yml");
    }

    private static Map<String, Object> readJson(InputStream inputStream) throws IOException {
        try {
            return objectMapper.readValue(inputStream, new TypeReference<Map<String, Object>>() {});
        } catch (JsonProcessingException e) {
            throw new ConfigurationException("Review policy is not valid JSON: " + e.getOriginalMessage(), e);
        }
    }

    private static Map<String, Object> readYaml(InputStream inputStream) {
        Object loaded;
        try {
            LoaderOptions options = new LoaderOptions();
            options.setAllowDuplicateKeys(false);
            loaded = new Yaml(options).load(inputStream);
        } catch (YAMLException e) {
            throw new ConfigurationException("Review policy is not valid YAML: " + e.getMessage(), e);
        }
        if (loaded == null) {
            return null;
        }
        if (!(loaded instanceof Map)) {
            throw new ConfigurationException("Review policy must be a mapping at the top level");
        }
        return asMap(loaded, "the policy root");
    }

    private static Map<String, TeamConfig> parseTeams(Map<String, Object> teamsMap) {
        Map<String, TeamConfig> teams = new LinkedHashMap<>();
        if (teamsMap == null) {
            return teams;
        }
        for (Map.Entry<String, Object> entry : teamsMap.entrySet()) {
            String where = "team '" + entry.getKey() + "'";
            Map<String, Object> teamMap = asMap(entry.getValue(), where);
            List<String> users = getStringList(teamMap, "users", where);
            teams.put(entry.getKey(), new TeamConfig(
                    getString(teamMap, "description", null),
                    users != null ? users : List.of()));
            log.debug("Parsed team {} with {} members", entry.getKey(), users != null ? users.size() : 0);
        }
        return teams;
    }

    private static Map<String, ReviewerRule> parseReviewers(Map<String, Object> reviewersMap) {
        if (reviewersMap == null) {
            throw new ConfigurationException("Review policy 'reviewers' must be a mapping, not null");
        }
        Map<String, ReviewerRule> reviewers = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : reviewersMap.entrySet()) {
            String where = "rule '" + entry.getKey() + "'";
            Map<String, Object> ruleMap = asMap(entry.getValue(), where);
            int count = getRequiredApproverCount(ruleMap, entry.getKey());
            String description = getString(ruleMap, "description", null);
            List<String> users = getStringList(ruleMap, "users", where);
            List<String> teams = getStringList(ruleMap, "teams", where);
            try {
                reviewers.put(entry.getKey(), new ReviewerRule(description, users, teams, count));
            } catch (ConfigurationException e) {
                throw new ConfigurationException("Rule '" + entry.getKey() + "': " + e.getMessage(), e);
            }
        }
        return reviewers;
    }

    private static List<OverrideCriteria> parseOverrides(Object value) {
        if (value == null) {
            return List.of();
        }
        if (!(value instanceof List<?> list)) {
            throw new ConfigurationException("Review policy 'overrides' must be a list");
        }
        List<OverrideCriteria> overrides = new ArrayList<>();
        for (int i = 0; i < list.size(); i++) {
            String where = "override #" + i;
            Map<String, Object> overrideMap = asMap(list.get(i), where);
            overrides.add(new OverrideCriteria(
                    getString(overrideMap, "description", null),
                    getStringList(overrideMap, "onlyModifiedByUsers", where),
                    getStringList(overrideMap, "onlyModifiedFileRegExs", where)));
        }
        return overrides;
    }

    // Helper methods

    /**
     * Accept only integral values that fit in an int; 1.5 or 2^32 + 1 are errors, never rounded or wrapped.
     */
    private static int getRequiredApproverCount(Map<String, Object> ruleMap, String prefix) {
        Object count = ruleMap.get("requiredApproverCount");
        if (!(count instanceof Integer || count instanceof Long || count instanceof BigInteger)) {
            throw new ConfigurationException("Rule '" + prefix
                    + "' must define an integer requiredApproverCount, found: " + count);
        }
        BigInteger value = count instanceof BigInteger big ? big : BigInteger.valueOf(((Number) count).longValue());
        try {
            return value.intValueExact();
        } catch (ArithmeticException e) {
            throw new ConfigurationException("Rule '" + prefix
                    + "' requiredApproverCount is out of range: " + count, e);
        }
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asMap(Object value, String where) {
        if (!(value instanceof Map<?, ?> map)) {
            throw new ConfigurationException("Expected an object for " + where);
        }
        for (Object key : map.keySet()) {
            if (!(key instanceof String)) {
                throw new ConfigurationException("Keys of " + where + " must be strings, found: " + key
                        + ". Quote it in YAML.");
            }
        }
        return (Map<String, Object>) value;
    }

    private static Map<String, Object> getMap(Map<String, Object> map, String key, String where) {
        Object value = map.get(key);
        return value == null ? null : asMap(value, where);
    }

    private static String getString(Map<String, Object> map, String key, String defaultValue) {
        Object value = map.get(key);
        return value != null ? value.toString() : defaultValue;
    }

    private static List<String> getStringList(Map<String, Object> map, String key, String where) {
        Object value = map.get(key);
        if (value == null) {
            return null;
        }
        if (!(value instanceof List<?> list)) {
            throw new ConfigurationException("'" + key + "' of " + where + " must be a list");
        }
        List<String> strings = new ArrayList<>(list.size());
        for (Object item : list) {
            if (!(item instanceof String s) || s.isBlank()) {
                throw new ConfigurationException("'" + key + "' of " + where
                        + " must contain only non-empty strings, found: " + item);
            }
            strings.add(s);
        }
        return strings;
    }
}
