package com.skillswap.common.encryption.scheduling;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Counters from one maintenance run.
 */
@Data
public class KeyMaintenanceReport {

    private int recoveredRotations;
    private int destroyedKeys;
    private int prunedVersions;
    private int backupsCreated;
    private int backupsVerified;
    private int backupFailures;
    private List<String> usageWarnings = new ArrayList<>();
    private boolean skipped;
}
