package com.bko.intervalcoach.coach;

import com.bko.intervalcoach.fitness.ProjectedDay;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

public interface ProjectionUseCase {
    /**
     * Projects fitness for the {@code days} days after today. Days without a planned load are rest days.
     */
    List<ProjectedDay> project(int days, Map<LocalDate, Double> plannedLoads);
}
