package com.skillswap.common.encryption;

import com.skillswap.common.encryption.model.EncryptionContext;
import com.skillswap.common.encryption.model.EncryptionKey;
import com.skillswap.common.encryption.model.KeyUsageRestrictions;
import com.skillswap.common.encryption.model.KeyUsageStatistics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.time.Instant;
import java.util.Collection;
import java.util.Map;
import java.util.Optional;

/**
 * Checks an operation against a key's usage restrictions.
 */
@Component
@Slf4j
public class KeyUsagePolicy {

    /**
     * @return the reason the operation is refused, or empty when it is allowed
     */
    public Optional<String> checkUsage(EncryptionKey key, EncryptionContext context, long bytes, Instant now) {
        Optional<String> limit = checkLimits(key, bytes);
        return limit.isPresent() ? limit : checkAccess(key, context, now);
    }

    /**
     * Operation-count and data-volume limits against the key's current statistics. Callers that
     * also record the operation must hold the key's usage lock.
     */
    public Optional<String> checkLimits(EncryptionKey key, long bytes) {
        KeyUsageRestrictions restrictions = key.getUsageRestrictions();
        if (restrictions == null) {
            return Optional.empty();
        }
        KeyUsageStatistics usage = key.getUsageStatistics() != null ? key.getUsageStatistics() : new KeyUsageStatistics();

        if (restrictions.getMaxOperations() != null && usage.getTotalOperations() >= restrictions.getMaxOperations()) {
            return Optional.of("Key has reached its maximum number of operations");
        }
        if (restrictions.getMaxDataBytes() != null
                && usage.getTotalBytesProcessed() + bytes > restrictions.getMaxDataBytes()) {
            return Optional.of("Key has reached its maximum data volume");
        }
        return Optional.empty();
    }

    /**
     * Caller, role, address and time-window rules.
     */
    public Optional<String> checkAccess(EncryptionKey key, EncryptionContext context, Instant now) {
        KeyUsageRestrictions restrictions = key.getUsageRestrictions();
        if (restrictions == null) {
            return Optional.empty();
        }
        Map<String, String> metadata = context != null && context.getMetadata() != null ? context.getMetadata() : Map.of();

        if (!isEmpty(restrictions.getAllowedUserIds())
                && (context == null || !restrictions.getAllowedUserIds().contains(context.getUserId()))) {
            return Optional.of("Caller is not permitted to use this key");
        }
        if (!isEmpty(restrictions.getAllowedRoles()) && !restrictions.getAllowedRoles().contains(metadata.get(EncryptionContext.ROLE))) {
            return Optional.of("Role is not permitted to use this key");
        }
        if (!isEmpty(restrictions.getAllowedIpRanges())) {
            String address = metadata.get(EncryptionContext.IP_ADDRESS);
            boolean permitted = address != null && restrictions.getAllowedIpRanges().stream()
                .anyMatch(range -> inRange(address, range));
            if (!permitted) {
                return Optional.of("Address is not permitted to use this key");
            }
        }
        if (!isEmpty(restrictions.getTimeWindows())
                && restrictions.getTimeWindows().stream().noneMatch(window -> window.permits(now))) {
            return Optional.of("Key may not be used at this time");
        }
        return Optional.empty();
    }

    static boolean inRange(String address, String cidr) {
        try {
            String[] parts = cidr.split("/", 2);
            byte[] network = InetAddress.getByName(parts[0].trim()).getAddress();
            byte[] candidate = InetAddress.getByName(address.trim()).getAddress();
            if (network.length != candidate.length) {
                return false;
            }
            int prefix = parts.length == 2 ? Integer.parseInt(parts[1].trim()) : network.length * 8;
            for (int i = 0; i < network.length && prefix > 0; i++, prefix -= 8) {
                int mask = prefix >= 8 ? 0xFF : (0xFF << (8 - prefix)) & 0xFF;
                if ((network[i] & mask) != (candidate[i] & mask)) {
                    return false;
                }
            }
            return true;
        } catch (UnknownHostException | NumberFormatException e) {
            log.warn("Ignoring unparseable address restriction {} for {}: {}", cidr, address, e.getMessage());
            return false;
        }
    }

    private static boolean isEmpty(Collection<?> values) {
        return values == null || values.isEmpty();
    }
}
