package com.bko.intervalcoach.workout;

import java.time.LocalDate;
import java.util.Objects;

public record GoalEvent(LocalDate date, EventPriority priority, String name, String description) {
    public GoalEvent {
        Objects.requireNonNull(date, "date");
        Objects.requireNonNull(priority, "priority");
    }
}
