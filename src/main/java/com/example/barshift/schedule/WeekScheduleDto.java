package com.example.barshift.schedule;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;

public record WeekScheduleDto(
        LocalDate weekStart,
        boolean published,
        Map<String, LinkedHashMap<String, String>> days,
        Map<String, Integer> loads,
        Map<String, String> unassignedReasons,
        long unassignedCount
) {
    public static WeekScheduleDto from(WorkingWeek week) {
        return new WeekScheduleDto(
                week.getWeekStart(),
                week.isPublished(),
                week.getSchedule().toRows(),
                new LinkedHashMap<>(week.getLoads()),
                new LinkedHashMap<>(week.getUnassignedReasons()),
                week.getSchedule().unassignedCount()
        );
    }

    public static WeekScheduleDto fromArchive(WeekSchedule schedule) {
        return new WeekScheduleDto(
                schedule.getWeekStart(),
                true,
                schedule.toRows(),
                schedule.countAssignments(),
                Map.of(),
                schedule.unassignedCount()
        );
    }
}
