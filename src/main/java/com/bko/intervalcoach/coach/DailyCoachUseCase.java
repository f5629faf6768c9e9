package com.bko.intervalcoach.coach;

import com.bko.intervalcoach.coach.app.CoachReport;

public interface DailyCoachUseCase {
    CoachReport runDaily();
}
