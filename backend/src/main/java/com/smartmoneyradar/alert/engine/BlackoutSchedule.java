package com.smartmoneyradar.alert.engine;

import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Collection;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Hours (in a fixed UTC offset) during which the alert threshold is raised by a fixed amount.
 */
public class BlackoutSchedule {

    private final Set<Integer> hours;
    private final int extraThreshold;
    private final ZoneOffset offset;

    public BlackoutSchedule(Collection<Integer> hours, int extraThreshold, ZoneOffset offset) {
        this.hours = hours == null ? Set.of() : hours.stream()
                .filter(h -> h != null && h >= 0 && h <= 23)
                .collect(Collectors.toUnmodifiableSet());
        this.extraThreshold = Math.max(0, extraThreshold);
        this.offset = offset;
    }

    public boolean isBlackout(Instant now) {
        return !hours.isEmpty() && hours.contains(now.atOffset(offset).getHour());
    }

    public int effectiveThreshold(int baseThreshold, Instant now) {
        return isBlackout(now) ? baseThreshold + extraThreshold : baseThreshold;
    }

    public int localHour(Instant now) {
        return now.atOffset(offset).getHour();
    }
}
