package com.bko.intervalcoach.fitness;

import java.time.LocalDate;

public record ProjectedDay(
        LocalDate date,
        double longAverage,
        double shortAverage,
        double form,
        double plannedLoad
) {
}
