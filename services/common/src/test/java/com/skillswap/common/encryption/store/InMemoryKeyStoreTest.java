package com.skillswap.common.encryption.store;

import com.skillswap.common.encryption.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for InMemoryKeyStore.
 *
 * Tests cover:
 * - Value expiry
 * - Sorted set ranges
 * - List ordering, ranges and retention
 */
@DisplayName("InMemoryKeyStore Unit Tests")
class InMemoryKeyStoreTest {

    private MutableClock clock;
    private InMemoryKeyStore keyStore;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-03-04T10:15:30Z"));
        keyStore = new InMemoryKeyStore(clock);
    }

    @Test
    @DisplayName("Should drop values once their time to live has passed")
    void shouldExpireValues() {
        // Given
        keyStore.set("keys:backup:backup_1", "payload", Duration.ofMinutes(5));
        keyStore.set("keys:data:key_1", "record");

        // When
        clock.advance(Duration.ofMinutes(5));

        // Then
        assertThat(keyStore.get("keys:backup:backup_1")).isEmpty();
        assertThat(keyStore.get("keys:data:key_1")).contains("record");
    }

    @Test
    @DisplayName("Should return sorted set members within the score range in score order")
    void shouldRangeByScore() {
        // Given
        keyStore.addToSortedSet("keys:rotation_tracking", "key_late", 300);
        keyStore.addToSortedSet("keys:rotation_tracking", "key_early", 100);
        keyStore.addToSortedSet("keys:rotation_tracking", "key_mid", 200);
        keyStore.removeFromSortedSet("keys:rotation_tracking", "key_mid");

        // Then
        assertThat(keyStore.rangeByScore("keys:rotation_tracking", 0, 300)).containsExactly("key_early", "key_late");
        assertThat(keyStore.rangeByScore("keys:rotation_tracking", 0, 150)).containsExactly("key_early");
        assertThat(keyStore.rangeByScore("keys:unknown", 0, 150)).isEmpty();
    }

    @Test
    @DisplayName("Should list newest entries first and honour negative indexes")
    void shouldRangeLists() {
        // Given
        keyStore.appendToList("encryption_log:20240304", "first", Duration.ofDays(1));
        keyStore.appendToList("encryption_log:20240304", "second", Duration.ofDays(1));
        keyStore.appendToList("encryption_log:20240304", "third", Duration.ofDays(1));

        // Then
        assertThat(keyStore.listRange("encryption_log:20240304", 0, -1)).containsExactly("third", "second", "first");
        assertThat(keyStore.listRange("encryption_log:20240304", 0, 0)).containsExactly("third");
        assertThat(keyStore.listRange("encryption_log:20240304", 5, 10)).isEmpty();
    }

    @Test
    @DisplayName("Should discard a list after its retention period")
    void shouldExpireLists() {
        // Given
        keyStore.appendToList("key_rotation_log:20240304", "entry", Duration.ofDays(1));

        // When
        clock.advance(Duration.ofDays(2));

        // Then
        assertThat(keyStore.listRange("key_rotation_log:20240304", 0, -1)).isEmpty();
    }

    @Test
    @DisplayName("Should return a snapshot of set members")
    void shouldSnapshotSets() {
        // Given
        keyStore.addToSet("keys:archived", "key_1");

        // When
        var members = keyStore.setMembers("keys:archived");
        keyStore.addToSet("keys:archived", "key_2");

        // Then
        assertThat(members).containsExactly("key_1");
        assertThat(keyStore.delete("keys:archived")).isTrue();
        assertThat(keyStore.setMembers("keys:archived")).isEmpty();
    }
}
