package com.ictskills.api;

import com.ictskills.domain.model.DashboardQuery;
import com.ictskills.domain.model.DashboardResponse;
import com.ictskills.domain.model.DashboardResult;
import com.ictskills.domain.model.DigitalDivide;
import com.ictskills.domain.model.TopAdvancedEntry;
import com.ictskills.domain.model.TrendPoint;
import com.ictskills.domain.service.DashboardService;
import com.ictskills.domain.service.EtlJobProcessor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.hamcrest.Matchers.nullValue;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Web-layer tests for SkillsAnalyticsController with mocked services.
 */
@ExtendWith(MockitoExtension.class)
class SkillsAnalyticsControllerTest {

    @Mock
    private DashboardService dashboardService;

    @Mock
    private EtlJobProcessor etlJobProcessor;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders
                .standaloneSetup(new SkillsAnalyticsController(dashboardService, etlJobProcessor))
                .build();
    }

    @Test
    void testGetDashboard_SerializesSnakeCaseShape() throws Exception {
        DashboardResponse response = DashboardResponse.builder()
                .startYear(2021)
                .endYear(2023)
                .snapshotYear(2023)
                .topAdvanced(List.of(new TopAdvancedEntry("Austria", 53.2)))
                .digitalDivide(new DigitalDivide(12.5, 40.0))
                .regionalTrends(Map.of("World", List.of(new TrendPoint(2022, 30.0), new TrendPoint(2023, 32.0))))
                .build();
        when(dashboardService.getDashboard(DashboardQuery.range(2021, 2023))).thenReturn(DashboardResult.ok(response));

        mockMvc.perform(get("/api/v1/skills/dashboard")
                        .param("start_year", "2021")
                        .param("end_year", "2023"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.start_year").value(2021))
                .andExpect(jsonPath("$.snapshot_year").value(2023))
                .andExpect(jsonPath("$.top_advanced[0].country_name").value("Austria"))
                .andExpect(jsonPath("$.top_advanced[0].pct_above_basic").value(53.2))
                .andExpect(jsonPath("$.digital_divide.top_tier_avg_growth").value(12.5))
                .andExpect(jsonPath("$.digital_divide.bottom_tier_avg_growth").value(40.0))
                .andExpect(jsonPath("$.correlation").isEmpty())
                .andExpect(jsonPath("$.depth_leaders").isEmpty())
                .andExpect(jsonPath("$.regional_trends.World[1].year").value(2023))
                .andExpect(jsonPath("$.regional_trends.World[1].value").value(32.0));
    }

    @Test
    void testGetDashboard_DefaultsToLegacyRange() throws Exception {
        when(dashboardService.getDashboard(any()))
                .thenReturn(DashboardResult.ok(DashboardResponse.empty(DashboardQuery.range(2021, 2023))));

        mockMvc.perform(get("/api/v1/skills/dashboard"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.snapshot_year").value(nullValue()));

        verify(dashboardService).getDashboard(DashboardQuery.range(2021, 2023));
    }

    @Test
    void testGetDashboard_YearParamIsSingleYearForm() throws Exception {
        when(dashboardService.getDashboard(any()))
                .thenReturn(DashboardResult.ok(DashboardResponse.empty(DashboardQuery.singleYear(2022))));

        mockMvc.perform(get("/api/v1/skills/dashboard").param("year", "2022").param("start_year", "2019"))
                .andExpect(status().isOk());

        verify(dashboardService).getDashboard(DashboardQuery.singleYear(2022));
    }

    @Test
    void testGetDashboard_FailureIsErrorPayloadNotFault() throws Exception {
        when(dashboardService.getDashboard(any())).thenReturn(
                DashboardResult.failure(DashboardResult.ErrorKind.DATA_SOURCE, "Unable to load skill records"));

        mockMvc.perform(get("/api/v1/skills/dashboard"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.error").value("Unable to load skill records"));
    }

    @Test
    void testSubmitEtlRun() throws Exception {
        UUID runId = UUID.randomUUID();
        when(etlJobProcessor.submitRun("2024/new.csv")).thenReturn(runId);

        mockMvc.perform(post("/api/v1/skills/etl/runs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"sourcePath\":\"2024/new.csv\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.runId").value(runId.toString()));
    }

    @Test
    void testSubmitEtlRun_WithoutBodyUsesDefaultSource() throws Exception {
        UUID runId = UUID.randomUUID();
        when(etlJobProcessor.submitRun(isNull())).thenReturn(runId);

        mockMvc.perform(post("/api/v1/skills/etl/runs"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.runId").value(runId.toString()));
    }

    @Test
    void testSubmitEtlRun_PathOutsideDataDirectoryIsBadRequest() throws Exception {
        when(etlJobProcessor.submitRun("../../etc/passwd"))
                .thenThrow(new IllegalArgumentException("Source path must be a file inside the data directory"));

        mockMvc.perform(post("/api/v1/skills/etl/runs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"sourcePath\":\"../../etc/passwd\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Source path must be a file inside the data directory"));
    }
}
