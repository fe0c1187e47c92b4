package com.skillswap.common.encryption.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DailyUsageStatistics {

    private String date;

    private long operationCount;

    private long encryptionCount;

    private long decryptionCount;

    private long bytesProcessed;
}
