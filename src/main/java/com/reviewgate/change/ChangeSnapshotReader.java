package com.reviewgate.change;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.reviewgate.exception.InputUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Reads a {@link ChangeSnapshot} from a JSON document:
 * <pre>
 * {
 *   "files":   ["src/a.ts"],
 *   "reviews": [{"user": "alice", "state": "APPROVED"}],
 *   "commits": [{"committer": "bot"}, {"committer": null}]
 * }
 * </pre>
 * Missing sections are read as empty lists.
 */
public class ChangeSnapshotReader {

    private static final Logger log = LoggerFactory.getLogger(ChangeSnapshotReader.class);

    private static final ObjectMapper objectMapper = new ObjectMapper();

    /**
     * Read a snapshot from a path. Supports classpath: prefix for classpath resources.
     *
     * @throws InputUnavailableException if the document is missing or malformed
     */
    public static ChangeSnapshot read(String path) {
        if (path == null || path.isBlank()) {
            throw new InputUnavailableException("No change snapshot configured");
        }
        log.info("Reading change snapshot from: {}", path);

        Resource resource = path.startsWith("classpath:")
                ? new ClassPathResource(path.substring("classpath:".length()))
                : new FileSystemResource(path);
        if (!resource.exists()) {
            throw new InputUnavailableException("Unable to retrieve change snapshot " + path);
        }
        try (InputStream inputStream = resource.getInputStream()) {
            ChangeSnapshot snapshot = parse(objectMapper.readValue(inputStream, new TypeReference<Map<String, Object>>() {}));
            log.info("Change snapshot: {} files, {} reviews, {} commits",
                    snapshot.files().size(), snapshot.reviews().size(), snapshot.committers().size());
            return snapshot;
        } catch (JsonProcessingException e) {
            throw new InputUnavailableException("Change snapshot is not valid JSON: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new InputUnavailableException("Failed to read change snapshot from: " + path, e);
        }
    }

    /**
     * Parse a snapshot from a JSON string.
     */
    public static ChangeSnapshot parseJson(String json) {
        try {
            return parse(objectMapper.readValue(json, new TypeReference<Map<String, Object>>() {}));
        } catch (JsonProcessingException e) {
            throw new InputUnavailableException("Change snapshot is not valid JSON: " + e.getOriginalMessage(), e);
        }
    }

    private static ChangeSnapshot parse(Map<String, Object> root) {
        if (root == null) {
            throw new InputUnavailableException("Change snapshot is empty");
        }
        List<String> files = new ArrayList<>();
        for (Object file : getList(root, "files")) {
            if (!(file instanceof String path)) {
                throw new InputUnavailableException("Change snapshot 'files' must contain strings, found: " + file);
            }
            files.add(path);
        }

        List<Review> reviews = new ArrayList<>();
        for (Object item : getList(root, "reviews")) {
            Map<String, Object> reviewMap = asMap(item, "reviews");
            Object state = reviewMap.get("state");
            if (state == null) {
                throw new InputUnavailableException("Change snapshot review is missing 'state': " + reviewMap);
            }
            try {
                reviews.add(new Review(getString(reviewMap, "user"), ReviewState.parse(state.toString())));
            } catch (IllegalArgumentException e) {
                throw new InputUnavailableException("Unknown review state '" + state + "'", e);
            }
        }

        List<String> committers = new ArrayList<>();
        for (Object item : getList(root, "commits")) {
            committers.add(getString(asMap(item, "commits"), "committer"));
        }

        return new ChangeSnapshot(files, reviews, committers);
    }

    private static List<?> getList(Map<String, Object> map, String key) {
        Object value = map.get(key);
        if (value == null) {
            return List.of();
        }
        if (!(value instanceof List<?> list)) {
            throw new InputUnavailableException("Change snapshot '" + key + "' must be a list");
        }
        return list;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asMap(Object value, String section) {
        if (!(value instanceof Map)) {
            throw new InputUnavailableException("Change snapshot '" + section + "' entries must be objects");
        }
        return (Map<String, Object>) value;
    }

    private static String getString(Map<String, Object> map, String key) {
        Object value = map.get(key);
        return value != null ? value.toString() : null;
    }
}
