package com.bko.intervalcoach.coach.web.dto;

import java.util.Map;

/**
 * @param plannedLoads training stress per ISO date; missing days are rest days
 */
public record ProjectionRequestDto(
        Integer days,
        Map<String, Double> plannedLoads
) { }
