package com.example.barshift.schedule;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.annotation.DirtiesContext;
import org.springframework.test.web.servlet.MockMvc;

import static org.hamcrest.Matchers.aMapWithSize;
import static org.hamcrest.Matchers.hasItem;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest(properties = {
        "barshift.storage.directory=target/test-data/${random.uuid}",
        "barshift.seed-defaults=false"
})
@AutoConfigureMockMvc
@DirtiesContext(classMode = DirtiesContext.ClassMode.AFTER_EACH_TEST_METHOD)
class ScheduleControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() throws Exception {
        mockMvc.perform(post("/api/config/shifts")
                .contentType(MediaType.APPLICATION_JSON)
                .content("""
                    { "label": "10-18" }
                    """))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.data.label").value("10-18"))
            .andExpect(jsonPath("$.data.active").value(true));

        mockMvc.perform(post("/api/workers")
                .contentType(MediaType.APPLICATION_JSON)
                .content("""
                    { "name": "Ana", "constraintText": "up to 2 shifts" }
                    """))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.success").value(true))
            .andExpect(jsonPath("$.data.maxShifts").value(2));
    }

    @Test
    void generate_returnsSevenDaysWithLoads() throws Exception {
        mockMvc.perform(post("/api/schedule/generate"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.published").value(false))
            .andExpect(jsonPath("$.data.days", aMapWithSize(7)))
            .andExpect(jsonPath("$.data.loads.Ana").value(2))
            .andExpect(jsonPath("$.data.unassignedCount").value(5))
            .andExpect(jsonPath("$.meta.slots").value(7))
            .andExpect(jsonPath("$.meta.weekOffset").value(0));
    }

    @Test
    void navigation_reportsTheWeekOffset() throws Exception {
        mockMvc.perform(post("/api/schedule/next"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.meta.weekOffset").value(1));

        mockMvc.perform(post("/api/schedule/today"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.meta.weekOffset").value(0));
    }

    @Test
    void createWorker_duplicateName_returnsConflict() throws Exception {
        mockMvc.perform(post("/api/workers")
                .contentType(MediaType.APPLICATION_JSON)
                .content("""
                    { "name": "Ana" }
                    """))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.error").value("DUPLICATE_WORKER"));
    }

    @Test
    void getWorker_knownAndUnknownName() throws Exception {
        mockMvc.perform(get("/api/workers/Ana"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.maxShifts").value(2));

        mockMvc.perform(get("/api/workers/Nobody"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.error").value("UNKNOWN_WORKER"))
            .andExpect(jsonPath("$.details.parameters[0]").value("Nobody"));
    }

    @Test
    void createShift_malformedLabel_returnsBadRequest() throws Exception {
        mockMvc.perform(post("/api/config/shifts")
                .contentType(MediaType.APPLICATION_JSON)
                .content("""
                    { "label": "ten-six" }
                    """))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("INVALID_SHIFT_LABEL"));
    }

    @Test
    void swap_withMissingFields_failsValidation() throws Exception {
        mockMvc.perform(post("/api/schedule/swap")
                .contentType(MediaType.APPLICATION_JSON)
                .content("""
                    { "day1": "Monday", "shift1": "10-18", "day2": "" }
                    """))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("VALIDATION_ERROR"))
            .andExpect(jsonPath("$.details.day2").value("day2 is required"));
    }

    @Test
    void override_unknownSlot_returnsNotFound() throws Exception {
        mockMvc.perform(post("/api/schedule/override")
                .contentType(MediaType.APPLICATION_JSON)
                .content("""
                    { "worker": "Ana", "day": "Monday", "shift": "18-2" }
                    """))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.error").value("UNKNOWN_SLOT"));
    }

    @Test
    void publish_archivesTheWeekAndLocksIt() throws Exception {
        mockMvc.perform(post("/api/schedule/generate"))
            .andExpect(status().isOk());

        mockMvc.perform(post("/api/schedule/publish"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.published").value(true));

        mockMvc.perform(get("/api/schedule/published"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.meta.count").value(1));

        mockMvc.perform(post("/api/schedule/swap")
                .contentType(MediaType.APPLICATION_JSON)
                .content("""
                    { "day1": "Monday", "shift1": "10-18", "day2": "Tuesday", "shift2": "10-18" }
                    """))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.error").value("WEEK_PUBLISHED"));

        mockMvc.perform(post("/api/schedule/publish"))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.error").value("WEEK_ALREADY_PUBLISHED"));
    }

    @Test
    void publishedWeek_notArchived_returnsNotFound() throws Exception {
        mockMvc.perform(get("/api/schedule/published/2000-01-02"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.success").value(false));
    }

    @Test
    void parseConstraints_returnsParsedRecordWithoutSaving() throws Exception {
        mockMvc.perform(post("/api/workers/parse")
                .contentType(MediaType.APPLICATION_JSON)
                .content("""
                    { "text": "Doesn't work Sunday\\nCan only work 10-18 or 14-22\\nLikes cocktails" }
                    """))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.constraint.restrictedDays", hasItem("Sunday")))
            .andExpect(jsonPath("$.data.constraint.allowedShifts[1]").value("14-22"))
            .andExpect(jsonPath("$.data.ignoredLines[0]").value("Likes cocktails"));
    }
}
