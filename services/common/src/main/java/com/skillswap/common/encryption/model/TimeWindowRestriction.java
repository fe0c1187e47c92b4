package com.skillswap.common.encryption.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.EnumSet;
import java.util.Set;

/**
 * Window during which a key may be used. Hours are UTC, start inclusive, end exclusive.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TimeWindowRestriction {

    @Builder.Default
    private Set<DayOfWeek> allowedDays = EnumSet.allOf(DayOfWeek.class);

    @Builder.Default
    private int startHour = 0;

    @Builder.Default
    private int endHour = 24;

    public boolean permits(Instant instant) {
        ZonedDateTime utc = instant.atZone(ZoneOffset.UTC);
        if (allowedDays != null && !allowedDays.isEmpty() && !allowedDays.contains(utc.getDayOfWeek())) {
            return false;
        }
        int hour = utc.getHour();
        return hour >= startHour && hour < endHour;
    }
}
