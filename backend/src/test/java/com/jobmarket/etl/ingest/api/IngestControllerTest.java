package com.jobmarket.etl.ingest.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.jobmarket.etl.ingest.DatabaseCleaner;
import com.jobmarket.etl.ingest.JobFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.springframework.web.context.WebApplicationContext;

import java.util.List;
import java.util.Map;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@ActiveProfiles("test")
class IngestControllerTest {

    @Autowired
    private WebApplicationContext context;

    @Autowired
    private JdbcTemplate jdbc;

    @Autowired
    private ObjectMapper objectMapper;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        DatabaseCleaner.clean(jdbc);
        this.mockMvc = MockMvcBuilders.webAppContextSetup(context).build();
    }

    @Test
    void ingestEndpointIsPostOnly() throws Exception {
        mockMvc.perform(get("/api/ingest"))
            .andExpect(status().isMethodNotAllowed());
    }

    @Test
    void emptyRecordListIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/ingest")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"records\": []}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("invalid_request"));
    }

    @Test
    void malformedBodyIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/ingest")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"records\": "))
            .andExpect(status().isBadRequest());
    }

    @Test
    void ingestReturnsQualityReportThenStatusShowsCounts() throws Exception {
        Map<String, Object> invalid = JobFixtures.validRecord("job-2");
        invalid.put("job_latitude", 95.0);
        String body = objectMapper.writeValueAsString(Map.of(
            "records", List.of(JobFixtures.validRecord("job-1"), invalid),
            "replaceExisting", false
        ));

        mockMvc.perform(post("/api/ingest").contentType(MediaType.APPLICATION_JSON).content(body))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.totalRecords").value(2))
            .andExpect(jsonPath("$.accepted").value(1))
            .andExpect(jsonPath("$.rejected").value(1))
            .andExpect(jsonPath("$.rejectedRecords[0].externalId").value("job-2"))
            .andExpect(jsonPath("$.rejectedRecords[0].reasons[0]").value("latitude out of range"))
            .andExpect(jsonPath("$.status").value("COMPLETED"));

        mockMvc.perform(get("/api/status"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.dbReachable").value(true))
            .andExpect(jsonPath("$.batchRunning").value(false))
            .andExpect(jsonPath("$.tableCounts.jobs").value(1))
            .andExpect(jsonPath("$.tableCounts.companies").value(1));
    }
}
