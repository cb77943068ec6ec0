package com.example.barshift;

import com.example.barshift.archive.PublishedWeekRepository;
import com.example.barshift.archive.SchedulePublisher;
import com.example.barshift.config.SchedulingSettings;
import com.example.barshift.config.ShiftCatalogRepository;
import com.example.barshift.config.ShiftCatalogService;
import com.example.barshift.schedule.RandomSource;
import com.example.barshift.schedule.SaturdayStreakTracker;
import com.example.barshift.schedule.ScheduleEditor;
import com.example.barshift.schedule.ScheduleGenerator;
import com.example.barshift.schedule.ScheduleService;
import com.example.barshift.schedule.WeekCalendar;
import com.example.barshift.schedule.WeekSchedule;
import com.example.barshift.storage.JsonDocumentStore;
import com.example.barshift.worker.ConstraintTextParser;
import com.example.barshift.worker.WorkerConstraintRepository;
import com.example.barshift.worker.WorkerConstraintService;

import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Wires the scheduling components by hand over a storage directory, with the date pinned to
 * Wednesday 2024-06-12 (week of Sunday 2024-06-09).
 */
public class EngineFixture {

    public static final LocalDate TODAY = LocalDate.of(2024, 6, 12);
    public static final LocalDate WEEK = LocalDate.of(2024, 6, 9);

    public final JsonDocumentStore store;
    public final SchedulingSettings settings;
    public final WeekCalendar calendar;
    public final ShiftCatalogService catalog;
    public final WorkerConstraintService workers;
    public final PublishedWeekRepository archive;
    public final SaturdayStreakTracker streaks;
    public final ScheduleGenerator generator;
    public final ScheduleEditor editor;
    public final SchedulePublisher publisher;
    public final ScheduleService service;

    public EngineFixture(Path directory, RandomSource random) {
        this.store = new JsonDocumentStore(directory);
        this.settings = SchedulingSettings.defaults(directory);
        this.calendar = new WeekCalendar(Clock.fixed(TODAY.atStartOfDay().toInstant(ZoneOffset.UTC), ZoneOffset.UTC));
        this.catalog = new ShiftCatalogService(new ShiftCatalogRepository(store));
        this.workers = new WorkerConstraintService(new WorkerConstraintRepository(store), new ConstraintTextParser());
        this.archive = new PublishedWeekRepository(store);
        this.streaks = new SaturdayStreakTracker(archive, workers, calendar);
        this.generator = new ScheduleGenerator(catalog, workers, streaks, archive, random, settings);
        this.editor = new ScheduleEditor();
        this.publisher = new SchedulePublisher(archive, streaks, settings);
        this.service = new ScheduleService(calendar, generator, editor, publisher, streaks);
    }

    /** Archives a week whose Saturday row holds the given workers, one per shift column. */
    public void archiveSaturday(LocalDate weekStart, String... saturdayWorkers) {
        LinkedHashMap<String, String> saturday = new LinkedHashMap<>();
        for (int i = 0; i < saturdayWorkers.length; i++) {
            saturday.put(i + "-" + (i + 8), saturdayWorkers[i]);
        }
        Map<String, Map<String, String>> rows = new LinkedHashMap<>();
        rows.put("Friday " + weekStart.plusDays(5), Map.of("10-18", WeekSchedule.UNASSIGNED));
        rows.put("Saturday " + weekStart.plusDays(6), saturday);
        archive.save(WeekSchedule.fromRows(weekStart, rows));
    }

    /** Loads without the zero entries, comparable to {@link WeekSchedule#countAssignments()}. */
    public static Map<String, Integer> nonZero(Map<String, Integer> loads) {
        Map<String, Integer> result = new LinkedHashMap<>();
        loads.forEach((worker, load) -> {
            if (load != 0) {
                result.put(worker, load);
            }
        });
        return result;
    }
}
