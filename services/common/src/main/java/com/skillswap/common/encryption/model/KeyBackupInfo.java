package com.skillswap.common.encryption.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class KeyBackupInfo {

    private String backupId;

    private Instant backupTimestamp;

    private String backupLocation;

    private String verificationHash;

    private BackupStatus status;

    private Instant lastVerified;

    public KeyBackupInfo copy() {
        return KeyBackupInfo.builder()
            .backupId(backupId)
            .backupTimestamp(backupTimestamp)
            .backupLocation(backupLocation)
            .verificationHash(verificationHash)
            .status(status)
            .lastVerified(lastVerified)
            .build();
    }
}
