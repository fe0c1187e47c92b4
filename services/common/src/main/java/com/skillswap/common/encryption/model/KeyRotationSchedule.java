package com.skillswap.common.encryption.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class KeyRotationSchedule {

    private Duration rotationInterval;

    private Instant nextRotation;

    private Instant lastRotation;

    private boolean autoRotate;

    private Duration warningThreshold;

    private Duration maxKeyAge;

    public KeyRotationSchedule copy() {
        return KeyRotationSchedule.builder()
            .rotationInterval(rotationInterval)
            .nextRotation(nextRotation)
            .lastRotation(lastRotation)
            .autoRotate(autoRotate)
            .warningThreshold(warningThreshold)
            .maxKeyAge(maxKeyAge)
            .build();
    }
}
