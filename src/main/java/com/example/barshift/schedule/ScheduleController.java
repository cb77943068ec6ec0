package com.example.barshift.schedule;

import com.example.barshift.common.ApiResponse;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/schedule")
public class ScheduleController {

    private static final Logger logger = LoggerFactory.getLogger(ScheduleController.class);

    private final ScheduleService scheduleService;

    public ScheduleController(ScheduleService scheduleService) {
        this.scheduleService = scheduleService;
    }

    @GetMapping
    public ResponseEntity<ApiResponse<WeekScheduleDto>> getCurrentWeek() {
        return ok("Week under view", scheduleService.currentWeek());
    }

    @PostMapping("/generate")
    public ResponseEntity<ApiResponse<WeekScheduleDto>> generate() {
        WorkingWeek week = scheduleService.regenerate();
        return ok(week.isPublished() ? "Week is published, archived schedule returned" : "Schedule generated", week);
    }

    @PostMapping("/next")
    public ResponseEntity<ApiResponse<WeekScheduleDto>> next() {
        return ok("Moved to next week", scheduleService.nextWeek());
    }

    @PostMapping("/previous")
    public ResponseEntity<ApiResponse<WeekScheduleDto>> previous() {
        return ok("Moved to previous week", scheduleService.previousWeek());
    }

    @PostMapping("/today")
    public ResponseEntity<ApiResponse<WeekScheduleDto>> today() {
        return ok("Moved to current week", scheduleService.thisWeek());
    }

    @PostMapping("/swap")
    public ResponseEntity<ApiResponse<WeekScheduleDto>> swap(@Valid @RequestBody SwapRequest request) {
        WorkingWeek week = scheduleService.swap(request.day1(), request.shift1(), request.day2(), request.shift2());
        return ok("Slots swapped", week);
    }

    @PostMapping("/override")
    public ResponseEntity<ApiResponse<WeekScheduleDto>> override(@Valid @RequestBody OverrideRequest request) {
        WorkingWeek week = scheduleService.overrideAssign(request.worker(), request.day(), request.shift());
        return ok("Slot overridden", week);
    }

    @PostMapping("/publish")
    public ResponseEntity<ApiResponse<WeekScheduleDto>> publish() {
        WorkingWeek week = scheduleService.publish();
        logger.info("Week {} published via API", week.getWeekStart());
        return ok("Week published", week);
    }

    @GetMapping("/streaks")
    public ResponseEntity<ApiResponse<Map<String, Integer>>> streaks(
            @RequestParam(name = "includeCurrent", required = false, defaultValue = "false") boolean includeCurrent) {
        Map<String, Integer> streaks = scheduleService.saturdayStreaks(includeCurrent);
        Map<String, Object> meta = new HashMap<>();
        meta.put("includeCurrent", includeCurrent);
        meta.put("weekStart", scheduleService.currentWeek().getWeekStart().toString());
        return ResponseEntity.ok(ApiResponse.success("Saturday streaks", streaks, meta));
    }

    @GetMapping("/published")
    public ResponseEntity<ApiResponse<List<String>>> publishedWeeks() {
        List<String> weeks = scheduleService.publishedWeeks();
        return ResponseEntity.ok(ApiResponse.success("Published weeks", weeks, Map.of("count", weeks.size())));
    }

    @GetMapping("/published/{weekStart}")
    public ResponseEntity<ApiResponse<WeekScheduleDto>> publishedWeek(
            @PathVariable @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate weekStart) {
        return scheduleService.publishedWeek(weekStart)
                .map(schedule -> ResponseEntity.ok(ApiResponse.success("Published week", WeekScheduleDto.fromArchive(schedule))))
                .orElse(ResponseEntity.status(HttpStatus.NOT_FOUND)
                        .body(ApiResponse.failure("Week " + weekStart + " is not published")));
    }

    private ResponseEntity<ApiResponse<WeekScheduleDto>> ok(String message, WorkingWeek week) {
        Map<String, Object> meta = new HashMap<>();
        meta.put("weekOffset", scheduleService.getWeekOffset());
        meta.put("slots", week.getSchedule().slotCount());
        return ResponseEntity.ok(ApiResponse.success(message, WeekScheduleDto.from(week), meta));
    }

    public record SwapRequest(
            @NotBlank(message = "day1 is required") String day1,
            @NotBlank(message = "shift1 is required") String shift1,
            @NotBlank(message = "day2 is required") String day2,
            @NotBlank(message = "shift2 is required") String shift2
    ) {}

    public record OverrideRequest(
            @NotBlank(message = "worker is required") String worker,
            @NotBlank(message = "day is required") String day,
            @NotBlank(message = "shift is required") String shift
    ) {}
}
