package com.skillswap.common.encryption;

import com.skillswap.common.encryption.model.EncryptionContext;
import com.skillswap.common.encryption.model.EncryptionKey;
import com.skillswap.common.encryption.model.KeyOperation;
import com.skillswap.common.encryption.model.KeyUsageRestrictions;
import com.skillswap.common.encryption.model.KeyUsageStatistics;
import com.skillswap.common.encryption.model.TimeWindowRestriction;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.DayOfWeek;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for KeyUsagePolicy.
 *
 * Tests cover:
 * - Operation and data volume limits
 * - Limit checks apart from access checks
 * - User, role and address restrictions
 * - Time windows
 */
@DisplayName("KeyUsagePolicy Unit Tests")
class KeyUsagePolicyTest {

    // A Monday
    private static final Instant NOW = Instant.parse("2024-03-04T10:15:30Z");

    private final KeyUsagePolicy policy = new KeyUsagePolicy();

    @Test
    @DisplayName("Should allow unrestricted key")
    void shouldAllowUnrestrictedKey() {
        assertThat(policy.checkUsage(key(new KeyUsageRestrictions()), null, 10, NOW)).isEmpty();
    }

    @Test
    @DisplayName("Should refuse once operation or byte limits are reached")
    void shouldEnforceLimits() {
        // Given
        EncryptionKey key = key(KeyUsageRestrictions.builder().maxOperations(2L).maxDataBytes(100L).build());
        key.getUsageStatistics().record(KeyOperation.ENCRYPT, 60, NOW);

        // Then
        assertThat(policy.checkUsage(key, null, 40, NOW)).isEmpty();
        assertThat(policy.checkUsage(key, null, 41, NOW)).isPresent();

        key.getUsageStatistics().record(KeyOperation.ENCRYPT, 1, NOW);
        assertThat(policy.checkUsage(key, null, 1, NOW)).contains("Key has reached its maximum number of operations");
    }

    @Test
    @DisplayName("Should keep limit checks separate from access checks")
    void shouldSeparateLimitsFromAccess() {
        // Given
        EncryptionKey key = key(KeyUsageRestrictions.builder()
            .maxOperations(1L)
            .allowedUserIds(Set.of("alice"))
            .build());
        key.getUsageStatistics().record(KeyOperation.ENCRYPT, 1, NOW);
        EncryptionContext alice = EncryptionContext.builder().userId("alice").build();

        // Then
        assertThat(policy.checkAccess(key, alice, NOW)).isEmpty();
        assertThat(policy.checkLimits(key, 1)).contains("Key has reached its maximum number of operations");
        assertThat(policy.checkAccess(key, EncryptionContext.builder().userId("bob").build(), NOW)).isPresent();
    }

    @Test
    @DisplayName("Should refuse user-restricted key without caller identity")
    void shouldRequireAllowedUser() {
        // Given
        EncryptionKey key = key(KeyUsageRestrictions.builder().allowedUserIds(Set.of("alice")).build());

        // Then
        assertThat(policy.checkUsage(key, null, 1, NOW)).isPresent();
        assertThat(policy.checkUsage(key, EncryptionContext.builder().userId("mallory").build(), 1, NOW)).isPresent();
        assertThat(policy.checkUsage(key, EncryptionContext.builder().userId("alice").build(), 1, NOW)).isEmpty();
    }

    @Test
    @DisplayName("Should match role from context metadata")
    void shouldRequireAllowedRole() {
        // Given
        EncryptionKey key = key(KeyUsageRestrictions.builder().allowedRoles(Set.of("billing")).build());

        // Then
        assertThat(policy.checkUsage(key, context(EncryptionContext.ROLE, "billing"), 1, NOW)).isEmpty();
        assertThat(policy.checkUsage(key, context(EncryptionContext.ROLE, "support"), 1, NOW)).isPresent();
    }

    @Test
    @DisplayName("Should match caller address against CIDR ranges")
    void shouldRequireAllowedAddress() {
        // Given
        EncryptionKey key = key(KeyUsageRestrictions.builder().allowedIpRanges(List.of("10.1.0.0/16", "192.168.1.7")).build());

        // Then
        assertThat(policy.checkUsage(key, context(EncryptionContext.IP_ADDRESS, "10.1.200.3"), 1, NOW)).isEmpty();
        assertThat(policy.checkUsage(key, context(EncryptionContext.IP_ADDRESS, "192.168.1.7"), 1, NOW)).isEmpty();
        assertThat(policy.checkUsage(key, context(EncryptionContext.IP_ADDRESS, "10.2.0.1"), 1, NOW)).isPresent();
        assertThat(policy.checkUsage(key, EncryptionContext.builder().build(), 1, NOW)).isPresent();
    }

    @Test
    @DisplayName("Should evaluate CIDR prefixes that do not fall on byte boundaries")
    void shouldMatchPartialBytePrefix() {
        assertThat(KeyUsagePolicy.inRange("172.16.5.1", "172.16.0.0/12")).isTrue();
        assertThat(KeyUsagePolicy.inRange("172.32.0.1", "172.16.0.0/12")).isFalse();
        assertThat(KeyUsagePolicy.inRange("10.0.0.1", "0.0.0.0/0")).isTrue();
        assertThat(KeyUsagePolicy.inRange("10.0.0.1", "10.0.0.0/abc")).isFalse();
        assertThat(KeyUsagePolicy.inRange("::1", "10.0.0.0/8")).isFalse();
    }

    @Test
    @DisplayName("Should only allow use inside a configured time window")
    void shouldEnforceTimeWindows() {
        // Given
        TimeWindowRestriction businessHours = TimeWindowRestriction.builder()
            .allowedDays(EnumSet.range(DayOfWeek.MONDAY, DayOfWeek.FRIDAY))
            .startHour(9)
            .endHour(17)
            .build();
        EncryptionKey key = key(KeyUsageRestrictions.builder().timeWindows(List.of(businessHours)).build());

        // Then
        assertThat(policy.checkUsage(key, null, 1, NOW)).isEmpty();
        assertThat(policy.checkUsage(key, null, 1, Instant.parse("2024-03-04T20:00:00Z"))).isPresent();
        assertThat(policy.checkUsage(key, null, 1, Instant.parse("2024-03-09T10:00:00Z"))).isPresent();
    }

    private static EncryptionKey key(KeyUsageRestrictions restrictions) {
        return EncryptionKey.builder()
            .id("key_1")
            .usageRestrictions(restrictions)
            .usageStatistics(new KeyUsageStatistics())
            .build();
    }

    private static EncryptionContext context(String name, String value) {
        return EncryptionContext.builder().metadata(Map.of(name, value)).build();
    }
}
