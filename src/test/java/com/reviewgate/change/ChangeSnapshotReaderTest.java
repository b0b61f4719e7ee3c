package com.reviewgate.change;

import com.reviewgate.exception.InputUnavailableException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ChangeSnapshotReader.
 */
class ChangeSnapshotReaderTest {

    @Test
    @DisplayName("Read files, reviews and commits from classpath")
    void readSnapshot() {
        ChangeSnapshot snapshot = ChangeSnapshotReader.read("classpath:changes/approved.json");

        assertEquals(List.of("src/a.ts", "README.md"), snapshot.files());
        assertEquals(4, snapshot.reviews().size());
        assertEquals(Arrays.asList("alice", null), snapshot.committers());
    }

    @Test
    @DisplayName("Approvals are derived from the review history")
    void derivesApprovals() {
        ChangeSet change = ChangeSnapshotReader.read("classpath:changes/approved.json").toChangeSet();

        assertEquals(Set.of("alice", "bob"), change.approvals());
        assertEquals(2, change.committers().size());
        assertNull(change.committers().get(1));
    }

    @Test
    @DisplayName("Missing sections read as empty")
    void missingSections() {
        ChangeSnapshot snapshot = ChangeSnapshotReader.parseJson("{\"files\": [\"a\"]}");

        assertEquals(List.of("a"), snapshot.files());
        assertTrue(snapshot.reviews().isEmpty());
        assertTrue(snapshot.committers().isEmpty());
    }

    @Test
    @DisplayName("Commit without committer is unresolved")
    void commitWithoutCommitter() {
        ChangeSnapshot snapshot = ChangeSnapshotReader.parseJson("{\"commits\": [{}, {\"committer\": \"bot\"}]}");

        assertEquals(Arrays.asList(null, "bot"), snapshot.committers());
    }

    @Test
    @DisplayName("Missing or malformed snapshots are unavailable input")
    void unavailable() {
        assertThrows(InputUnavailableException.class,
                () -> ChangeSnapshotReader.read("classpath:changes/does-not-exist.json"));
        assertThrows(InputUnavailableException.class, () -> ChangeSnapshotReader.read(null));
        assertThrows(InputUnavailableException.class, () -> ChangeSnapshotReader.parseJson("{\"files\": "));
        assertThrows(InputUnavailableException.class, () -> ChangeSnapshotReader.parseJson("{\"files\": [1]}"));
    }

    @Test
    @DisplayName("Unknown review state is rejected")
    void unknownState() {
        InputUnavailableException e = assertThrows(InputUnavailableException.class,
                () -> ChangeSnapshotReader.read("classpath:changes/unknown-state.json"));
        assertTrue(e.getMessage().contains("LGTM"));
    }
}
