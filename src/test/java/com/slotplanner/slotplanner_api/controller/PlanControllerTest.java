package com.slotplanner.slotplanner_api.controller;

import static org.hamcrest.Matchers.hasSize;
import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

@SpringBootTest
@AutoConfigureMockMvc
class PlanControllerTest {

    private static final String MONDAY_EIGHT = """
            [{"weekday": "MONDAY", "startTime": "08:00"},
             {"weekday": "MONDAY", "startTime": "08:15"},
             {"weekday": "MONDAY", "startTime": "08:30"}]""";

    private static final String SOLVE_BODY = """
            {
              "children": [
                {"id": "C1", "name": "Mia", "availability": %1$s, "preferredTeacherIds": ["T1"], "earlyPreferred": true},
                {"id": "C2", "name": "Ben", "availability": %1$s}
              ],
              "teachers": [
                {"id": "T1", "name": "Ms Hall", "availability": %1$s}
              ],
              "tandems": [{"childA": "C1", "childB": "C2"}],
              "weights": {"preferred_teacher": 5, "priority_early_slot": 3, "tandem_fulfilled": 4,
                          "teacher_pause_respected": 1, "preserve_existing_plan": 10},
              "timeLimitSeconds": 10
            }""".formatted(MONDAY_EIGHT);

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Test
    void solveReturnsPlan() throws Exception {
        mockMvc.perform(post("/api/plans/solve").contentType(MediaType.APPLICATION_JSON).content(SOLVE_BODY))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("OPTIMAL"))
                .andExpect(jsonPath("$.assignments", hasSize(2)))
                .andExpect(jsonPath("$.assignments[0].childId").value("C1"))
                .andExpect(jsonPath("$.assignments[0].startTime").value("08:00"))
                .andExpect(jsonPath("$.violations", hasSize(0)))
                .andExpect(jsonPath("$.score.tandemFulfilled").value(4.0))
                .andExpect(jsonPath("$.runtimeMillis").exists());
    }

    @Test
    void invalidInputListsAllErrors() throws Exception {
        String body = """
                {
                  "children": [{"id": "C1", "availability": [{"weekday": "SATURDAY", "startTime": "08:00"}]},
                               {"id": "C1", "availability": []}],
                  "teachers": []
                }""";

        mockMvc.perform(post("/api/plans/solve").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errors", hasSize(2)));
    }

    @Test
    void submittedJobCanBePolledAndFetched() throws Exception {
        MvcResult submitted = mockMvc.perform(post("/api/plans/jobs")
                        .contentType(MediaType.APPLICATION_JSON).content(SOLVE_BODY))
                .andExpect(status().isAccepted())
                .andReturn();
        String problemId = objectMapper.readTree(submitted.getResponse().getContentAsString()).get("problemId").asText();

        String solverStatus = "";
        for (int i = 0; i < 200 && !solverStatus.equals("NOT_SOLVING"); i++) {
            MvcResult polled = mockMvc.perform(get("/api/plans/jobs/{id}/status", problemId))
                    .andExpect(status().isOk())
                    .andReturn();
            JsonNode status = objectMapper.readTree(polled.getResponse().getContentAsString());
            solverStatus = status.get("status").asText();
            if (!solverStatus.equals("NOT_SOLVING")) Thread.sleep(50);
        }
        assertEquals("NOT_SOLVING", solverStatus);

        mockMvc.perform(get("/api/plans/jobs/{id}", problemId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("OPTIMAL"));
        // a fetched plan is released
        mockMvc.perform(get("/api/plans/jobs/{id}", problemId))
                .andExpect(status().isNotFound());
        mockMvc.perform(delete("/api/plans/jobs/{id}", problemId))
                .andExpect(status().isNotFound());
    }

    @Test
    void tandemPriorityScalesTheTandemTerm() throws Exception {
        String body = SOLVE_BODY.replace("\"childB\": \"C2\"}", "\"childB\": \"C2\", \"priority\": 10}");

        mockMvc.perform(post("/api/plans/solve").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.score.tandemFulfilled").value(8.0));
    }

    @Test
    void tandemPriorityOutOfRangeIsRejected() throws Exception {
        String body = SOLVE_BODY.replace("\"childB\": \"C2\"}", "\"childB\": \"C2\", \"priority\": 0}");

        mockMvc.perform(post("/api/plans/solve").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errors", hasSize(1)));
    }

    @Test
    void unknownJobIsNotFound() throws Exception {
        mockMvc.perform(get("/api/plans/jobs/{id}/status", "no-such-job"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.message").exists());
    }

    @Test
    void explainReportsUnmetGoals() throws Exception {
        String body = """
                {
                  "assignments": [{"childId": "C1", "teacherId": "T1", "weekday": "MONDAY", "startTime": "08:00"}],
                  "children": [
                    {"id": "C1", "availability": %1$s, "preferredTeacherIds": ["T2"]},
                    {"id": "C2", "availability": %1$s}
                  ],
                  "teachers": [{"id": "T1", "availability": %1$s}, {"id": "T2", "availability": %1$s}]
                }""".formatted(MONDAY_EIGHT);

        mockMvc.perform(post("/api/plans/explain").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(2)))
                .andExpect(jsonPath("$[0].kind").value("preferred_teacher_unmet"))
                .andExpect(jsonPath("$[1].kind").value("unassigned_child"))
                .andExpect(jsonPath("$[1].subjectIds[0]").value("C2"));
    }

    @Test
    void diffComparesAgainstPreviousPlan() throws Exception {
        String body = """
                {
                  "assignments": [{"childId": "C1", "teacherId": "T1", "weekday": "MONDAY", "startTime": "08:00"}],
                  "previousPlan": {"assignments": [
                    {"childId": "C1", "teacherId": "T1", "weekday": "MONDAY", "startTime": "09:00"}]}
                }""";

        mockMvc.perform(post("/api/plans/diff").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].kind").value("changed"))
                .andExpect(jsonPath("$[0].old.startTime").value("09:00"))
                .andExpect(jsonPath("$[0].new.startTime").value("08:00"));
    }

    @Test
    void healthReportsSolverSetup() throws Exception {
        mockMvc.perform(get("/api/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("UP"))
                .andExpect(jsonPath("$.solver.backend").value("branch-and-bound"))
                .andExpect(jsonPath("$.grid.earlyCutoff").value("12:00"));
    }
}
