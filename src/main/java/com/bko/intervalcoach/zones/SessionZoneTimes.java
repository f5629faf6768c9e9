package com.bko.intervalcoach.zones;

import java.time.LocalDate;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Raw time-in-zone data of one completed session, as delivered by the data provider.
 */
public record SessionZoneTimes(
        String sessionId,
        LocalDate date,
        int movingTimeSeconds,
        Map<Zone, Integer> secondsByZone,
        double load
) {
    public SessionZoneTimes {
        Objects.requireNonNull(date, "date");
        EnumMap<Zone, Integer> copy = new EnumMap<>(Zone.class);
        if (secondsByZone != null) {
            secondsByZone.forEach((zone, seconds) -> {
                if (zone != null && seconds != null && seconds > 0) {
                    copy.put(zone, seconds);
                }
            });
        }
        secondsByZone = Collections.unmodifiableMap(copy);
        load = Math.max(0.0, load);
    }

    public int seconds(Zone zone) {
        return secondsByZone.getOrDefault(zone, 0);
    }
}
