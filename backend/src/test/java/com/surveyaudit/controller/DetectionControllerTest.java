package com.surveyaudit.controller;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
class DetectionControllerTest {

    private static final String DATASET = """
            {
              "id": "ds-web",
              "collectedAt": "2024-05-01T00:00:00Z",
              "fields": [
                {"name": "respondent_id", "type": "IDENTIFIER", "identifier": true, "role": "RESPONDENT_ID"},
                {"name": "q1", "type": "NUMERIC"},
                {"name": "q2", "type": "NUMERIC"},
                {"name": "q3", "type": "NUMERIC"}
              ],
              "records": [
                {"respondent_id": "R1", "q1": 3, "q2": 3, "q3": 3},
                {"respondent_id": "R2", "q1": 1, "q2": 4, "q3": 2},
                {"respondent_id": "R3", "q1": 5, "q2": 2, "q3": 4}
              ]
            }
            """;

    @Autowired
    private MockMvc mockMvc;

    @Test
    void shouldUploadDatasetAndRunSelectedCheck() throws Exception {
        mockMvc.perform(post("/api/datasets").contentType(MediaType.APPLICATION_JSON).content(DATASET))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.id").value("ds-web"))
                .andExpect(jsonPath("$.records").value(3));

        mockMvc.perform(post("/api/runs").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"runId\": \"run-web\", \"datasetId\": \"ds-web\", \"checkIds\": [\"QC_PAT_01\"]}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.runId").value("run-web"))
                .andExpect(jsonPath("$.totalRecords").value(3))
                .andExpect(jsonPath("$.checkStatuses[0].status").value("COMPLETED"))
                .andExpect(jsonPath("$.issues", hasSize(1)))
                .andExpect(jsonPath("$.issues[0].recordId").value("R1"));

        mockMvc.perform(get("/api/runs/run-web"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.datasetId").value("ds-web"));

        mockMvc.perform(get("/api/runs/run-web/export").param("format", "pdf"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void shouldRejectRunWithoutDatasetId() throws Exception {
        mockMvc.perform(post("/api/runs").contentType(MediaType.APPLICATION_JSON).content("{\"datasetId\": \" \"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").exists());
    }

    @Test
    void shouldReturnNotFoundForUnknownResources() throws Exception {
        mockMvc.perform(post("/api/runs").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"datasetId\": \"no-such-dataset\"}"))
                .andExpect(status().isNotFound());
        mockMvc.perform(get("/api/runs/no-such-run"))
                .andExpect(status().isNotFound());
        mockMvc.perform(get("/api/datasets/no-such-dataset/scorecard"))
                .andExpect(status().isNotFound());
    }

    @Test
    void shouldListBuiltInChecksAndModels() throws Exception {
        mockMvc.perform(get("/api/checks"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].check.id").value("QC_BEH_01"));
        mockMvc.perform(get("/api/models"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.BOT", hasSize(1)));
        mockMvc.perform(post("/api/checks/NO_SUCH_CHECK/versions").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"parameters\": {}}"))
                .andExpect(status().isNotFound());
    }
}
