package com.example.barshift.schedule;

import com.example.barshift.EngineFixture;
import com.example.barshift.exception.BusinessException;
import com.example.barshift.worker.WorkerConstraint;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import java.util.Random;

import static com.example.barshift.EngineFixture.WEEK;
import static com.example.barshift.EngineFixture.nonZero;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ScheduleEditorTest {

    private static final String SUNDAY = "Sunday 2024-06-09";
    private static final String SATURDAY = "Saturday 2024-06-15";

    @TempDir
    Path dir;

    private EngineFixture engine;
    private ScheduleEditor editor;
    private WorkingWeek week;

    @BeforeEach
    void setUp() {
        engine = new EngineFixture(dir, new DefaultRandomSource(new Random(42)));
        engine.catalog.add("10-18", true);
        engine.catalog.add("18-2", true);
        engine.workers.add("Ana", null);
        engine.workers.add("Ben", null);
        editor = engine.editor;
        week = engine.generator.generate(WEEK);
    }

    @Test
    void swap_twice_restoresScheduleAndLoads() {
        WeekSchedule before = week.getSchedule().copy();
        Map<String, Integer> loadsBefore = new HashMap<>(week.getLoads());

        editor.swap(week, SUNDAY, "10-18", SATURDAY, "18-2");
        editor.swap(week, SUNDAY, "10-18", SATURDAY, "18-2");

        assertThat(week.getSchedule()).isEqualTo(before);
        assertThat(week.getLoads()).isEqualTo(loadsBefore);
    }

    @Test
    void swap_exchangesOccupantsAndKeepsLoadsConsistent() {
        editor.overrideAssign(week, "Ana", SUNDAY, "10-18");
        editor.overrideAssign(week, WeekSchedule.UNASSIGNED, SATURDAY, "18-2");

        editor.swap(week, "Sunday", "10-18", "saturday", "18-2");

        assertThat(week.getSchedule().get(SUNDAY, "10-18")).contains(WeekSchedule.UNASSIGNED);
        assertThat(week.getSchedule().get(SATURDAY, "18-2")).contains("Ana");
        assertThat(nonZero(week.getLoads())).isEqualTo(week.getSchedule().countAssignments());
        assertThat(week.getUnassignedReasons()).containsKey("Sunday - 10-18").doesNotContainKey("Saturday - 18-2");
    }

    @Test
    void swap_sameSlot_changesNothing() {
        WeekSchedule before = week.getSchedule().copy();
        Map<String, Integer> loadsBefore = new HashMap<>(week.getLoads());

        editor.swap(week, SUNDAY, "10-18", SUNDAY, "10-18");

        assertThat(week.getSchedule()).isEqualTo(before);
        assertThat(week.getLoads()).isEqualTo(loadsBefore);
    }

    @Test
    void swap_sameSlot_keepsLoadOfWorkerHoldingOnlyThatSlot(@TempDir Path otherDir) {
        EngineFixture single = new EngineFixture(otherDir, new DefaultRandomSource(new Random(1)));
        single.catalog.add("10-18", true);
        single.workers.add("Wes", new WorkerConstraint(null, null, null, 1));
        WorkingWeek singleWeek = single.generator.generate(WEEK);
        assertThat(singleWeek.getSchedule().get(SUNDAY, "10-18")).contains("Wes");
        assertThat(singleWeek.getLoads()).containsEntry("Wes", 1);

        single.editor.swap(singleWeek, "Sunday", "10-18", SUNDAY, "10-18");

        assertThat(singleWeek.getLoads()).containsEntry("Wes", 1);
        assertThat(nonZero(singleWeek.getLoads())).isEqualTo(singleWeek.getSchedule().countAssignments());
    }

    @Test
    void overrideAssign_ignoresConstraintsAndMovesLoad() {
        engine.workers.update("Ben", engine.workers.find("Ben").orElseThrow().withRestrictedDay("Sunday"));
        String outgoing = week.getSchedule().get(SUNDAY, "18-2").orElseThrow();
        int outgoingLoad = week.loadOf(outgoing);
        int benLoad = week.loadOf("Ben");

        editor.overrideAssign(week, "Ben", SUNDAY, "18-2");

        assertThat(week.getSchedule().get(SUNDAY, "18-2")).contains("Ben");
        if (!"Ben".equals(outgoing)) {
            assertThat(week.loadOf("Ben")).isEqualTo(benLoad + 1);
            if (WeekSchedule.isAssigned(outgoing)) {
                assertThat(week.loadOf(outgoing)).isEqualTo(outgoingLoad - 1);
            }
        }
        assertThat(nonZero(week.getLoads())).isEqualTo(week.getSchedule().countAssignments());
        assertThat(week.getUnassignedReasons()).doesNotContainKey("Sunday - 18-2");
    }

    @Test
    void overrideAssign_unassignedClearsSlot() {
        editor.overrideAssign(week, "Ana", SATURDAY, "10-18");
        int anaLoad = week.loadOf("Ana");

        editor.overrideAssign(week, WeekSchedule.UNASSIGNED, SATURDAY, "10-18");

        assertThat(week.getSchedule().get(SATURDAY, "10-18")).contains(WeekSchedule.UNASSIGNED);
        assertThat(week.loadOf("Ana")).isEqualTo(anaLoad - 1);
        assertThat(week.getUnassignedReasons()).containsEntry("Saturday - 10-18", ScheduleEditor.CLEARED_MANUALLY);
    }

    @Test
    void overrideAssign_unknownWorkerIsAllowed() {
        editor.overrideAssign(week, "Guest", SUNDAY, "10-18");

        assertThat(week.loadOf("Guest")).isEqualTo(1);
        assertThat(nonZero(week.getLoads())).isEqualTo(week.getSchedule().countAssignments());
    }

    @Test
    void edits_onUnknownSlot_areRejected() {
        assertThatThrownBy(() -> editor.swap(week, SUNDAY, "10-18", SUNDAY, "14-22"))
                .isInstanceOf(BusinessException.class)
                .extracting(e -> ((BusinessException) e).getErrorCode())
                .isEqualTo(BusinessException.UNKNOWN_SLOT);
        assertThatThrownBy(() -> editor.overrideAssign(week, "Ana", "Funday", "10-18"))
                .extracting(e -> ((BusinessException) e).getErrorCode())
                .isEqualTo(BusinessException.UNKNOWN_SLOT);
    }

    @Test
    void edits_onPublishedWeek_areRejected() {
        engine.publisher.publish(WEEK, week.getSchedule());
        WorkingWeek published = engine.generator.generate(WEEK);

        assertThatThrownBy(() -> editor.swap(published, SUNDAY, "10-18", SATURDAY, "18-2"))
                .extracting(e -> ((BusinessException) e).getErrorCode())
                .isEqualTo(BusinessException.WEEK_PUBLISHED);
        assertThatThrownBy(() -> editor.overrideAssign(published, "Ana", SUNDAY, "10-18"))
                .extracting(e -> ((BusinessException) e).getErrorCode())
                .isEqualTo(BusinessException.WEEK_PUBLISHED);
        assertThat(engine.archive.find(WEEK)).contains(week.getSchedule());
    }
}
