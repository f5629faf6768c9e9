package com.bko.intervalcoach.workout;

import java.time.LocalDate;
import java.util.List;

/**
 * Highest-priority events the day after and the day before the recommendation date; null when none.
 */
public record EventProximity(EventPriority tomorrow, EventPriority yesterday) {
    public static final EventProximity NONE = new EventProximity(null, null);

    public static EventProximity around(LocalDate date, List<GoalEvent> events) {
        if (events == null || events.isEmpty()) {
            return NONE;
        }
        return new EventProximity(
                highestOn(date.plusDays(1), events),
                highestOn(date.minusDays(1), events));
    }

    private static EventPriority highestOn(LocalDate date, List<GoalEvent> events) {
        EventPriority highest = null;
        for (GoalEvent event : events) {
            if (event.date().equals(date) && (highest == null || event.priority().compareTo(highest) < 0)) {
                highest = event.priority();
            }
        }
        return highest;
    }
}
