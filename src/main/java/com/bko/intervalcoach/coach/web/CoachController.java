package com.bko.intervalcoach.coach.web;

import com.bko.intervalcoach.coach.DailyCoachUseCase;
import com.bko.intervalcoach.coach.ProjectionUseCase;
import com.bko.intervalcoach.coach.app.CoachReport;
import com.bko.intervalcoach.coach.web.dto.ProjectionRequestDto;
import com.bko.intervalcoach.fitness.ProjectedDay;
import com.bko.intervalcoach.shared.AppSettings;
import com.bko.intervalcoach.shared.ConfigStatus;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/coach")
public class CoachController {
    private static final int DEFAULT_PROJECTION_DAYS = 14;

    private final DailyCoachUseCase dailyCoachUseCase;
    private final ProjectionUseCase projectionUseCase;
    private final AppSettings settings;

    public CoachController(DailyCoachUseCase dailyCoachUseCase, ProjectionUseCase projectionUseCase, AppSettings settings) {
        this.dailyCoachUseCase = dailyCoachUseCase;
        this.projectionUseCase = projectionUseCase;
        this.settings = settings;
    }

    @GetMapping(value = "/recommendation", produces = MediaType.APPLICATION_JSON_VALUE)
    public CoachReport recommendation() {
        return dailyCoachUseCase.runDaily();
    }

    @GetMapping(value = "/projection", produces = MediaType.APPLICATION_JSON_VALUE)
    public List<ProjectedDay> projection(@RequestParam(name = "days", defaultValue = "14") int days) {
        return projectionUseCase.project(days, Map.of());
    }

    @PostMapping(value = "/projection", consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public List<ProjectedDay> projection(@RequestBody ProjectionRequestDto requestDto) {
        int days = requestDto.days() != null ? requestDto.days() : DEFAULT_PROJECTION_DAYS;
        return projectionUseCase.project(days, toPlannedLoads(requestDto.plannedLoads()));
    }

    @GetMapping(value = "/status", produces = MediaType.APPLICATION_JSON_VALUE)
    public ConfigStatus status() {
        return ConfigStatus.from(settings);
    }

    private Map<LocalDate, Double> toPlannedLoads(Map<String, Double> raw) {
        if (raw == null) return Map.of();
        Map<LocalDate, Double> planned = new HashMap<>();
        raw.forEach((date, load) -> {
            try {
                planned.put(LocalDate.parse(date), load);
            } catch (DateTimeParseException e) {
                throw new IllegalArgumentException("Planned load date is not an ISO date: " + date, e);
            }
        });
        return planned;
    }
}
