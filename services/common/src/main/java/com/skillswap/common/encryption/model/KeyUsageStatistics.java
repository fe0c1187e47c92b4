package com.skillswap.common.encryption.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.TreeMap;

/**
 * Running usage counters for a key, with per-day rollups keyed by ISO date (UTC).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class KeyUsageStatistics {

    public static final int DAILY_RETENTION_DAYS = 90;

    private long totalOperations;

    private long encryptionCount;

    private long decryptionCount;

    private long totalBytesProcessed;

    private Instant firstUsed;

    private Instant lastUsed;

    @Builder.Default
    private Map<String, DailyUsageStatistics> dailyUsage = new TreeMap<>();

    /**
     * Records one operation and drops daily rollups older than {@link #DAILY_RETENTION_DAYS}.
     */
    public void record(KeyOperation operation, long bytes, Instant now) {
        totalOperations++;
        totalBytesProcessed += bytes;
        if (operation == KeyOperation.ENCRYPT) {
            encryptionCount++;
        } else {
            decryptionCount++;
        }
        if (firstUsed == null) {
            firstUsed = now;
        }
        lastUsed = now;

        if (dailyUsage == null) {
            dailyUsage = new TreeMap<>();
        }
        LocalDate today = LocalDate.ofInstant(now, ZoneOffset.UTC);
        DailyUsageStatistics day = dailyUsage.computeIfAbsent(today.toString(),
            d -> DailyUsageStatistics.builder().date(d).build());
        day.setOperationCount(day.getOperationCount() + 1);
        day.setBytesProcessed(day.getBytesProcessed() + bytes);
        if (operation == KeyOperation.ENCRYPT) {
            day.setEncryptionCount(day.getEncryptionCount() + 1);
        } else {
            day.setDecryptionCount(day.getDecryptionCount() + 1);
        }

        String cutoff = today.minusDays(DAILY_RETENTION_DAYS).toString();
        dailyUsage.keySet().removeIf(date -> date.compareTo(cutoff) < 0);
    }

    public long operationsOn(LocalDate date) {
        if (dailyUsage == null) {
            return 0;
        }
        DailyUsageStatistics day = dailyUsage.get(date.toString());
        return day == null ? 0 : day.getOperationCount();
    }
}
