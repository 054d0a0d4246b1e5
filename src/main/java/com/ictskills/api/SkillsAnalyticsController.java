package com.ictskills.api;

import com.ictskills.domain.model.DashboardQuery;
import com.ictskills.domain.model.DashboardResult;
import com.ictskills.domain.model.EtlRunRequest;
import com.ictskills.domain.service.DashboardService;
import com.ictskills.domain.service.EtlJobProcessor;
import com.ictskills.infrastructure.persistence.entity.EtlRunEntity;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;
import java.util.UUID;

/**
 * REST API for the skills dashboard and ETL runs.
 *
 * Endpoints:
 * - GET /api/v1/skills/dashboard - Dashboard aggregates for a year or year range
 * - POST /api/v1/skills/etl/runs - Submit an ETL run
 * - GET /api/v1/skills/etl/runs/{runId} - Get ETL run status
 * - GET /api/v1/skills/health - Health check
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/skills")
@RequiredArgsConstructor
public class SkillsAnalyticsController {

    static final int DEFAULT_START_YEAR = 2021;
    static final int DEFAULT_END_YEAR = 2023;

    private final DashboardService dashboardService;
    private final EtlJobProcessor etlJobProcessor;

    /**
     * Dashboard aggregates.
     *
     * GET /api/v1/skills/dashboard?start_year=2021&end_year=2023
     * GET /api/v1/skills/dashboard?year=2023
     *
     * Query Parameters:
     * - year (optional): single-year form, takes precedence over the range
     * - start_year (optional): start of range (default: 2021)
     * - end_year (optional): end of range (default: 2023)
     *
     * Always answers 200. A failed query returns {"error": "..."} so the
     * dashboard can render a degraded state.
     */
    @GetMapping("/dashboard")
    public ResponseEntity<Object> getDashboard(
            @RequestParam(name = "year", required = false) Integer year,
            @RequestParam(name = "start_year", required = false) Integer startYear,
            @RequestParam(name = "end_year", required = false) Integer endYear) {

        DashboardQuery query = year != null
                ? DashboardQuery.singleYear(year)
                : DashboardQuery.range(
                        startYear != null ? startYear : DEFAULT_START_YEAR,
                        endYear != null ? endYear : DEFAULT_END_YEAR);

        log.info("Dashboard query: startYear={}, endYear={}", query.getStartYear(), query.getEndYear());

        DashboardResult result = dashboardService.getDashboard(query);

        if (!result.isOk()) {
            return ResponseEntity.ok(Map.of("error", result.getErrorMessage()));
        }
        return ResponseEntity.ok(result.getResponse());
    }

    /**
     * Submit an ETL run.
     *
     * POST /api/v1/skills/etl/runs
     *
     * Request body (optional):
     * {
     *   "sourcePath": "ITU_DH_SKLS_DIG_CONT.csv"
     * }
     *
     * The path is relative to the ETL data directory. A path outside it
     * is rejected with 400.
     *
     * Response:
     * {
     *   "runId": "uuid"
     * }
     */
    @PostMapping("/etl/runs")
    public ResponseEntity<Map<String, UUID>> submitEtlRun(
            @Valid @RequestBody(required = false) EtlRunRequest request) {

        String sourcePath = request != null ? request.getSourcePath() : null;
        log.info("Submit ETL run: sourcePath={}", sourcePath);

        UUID runId = etlJobProcessor.submitRun(sourcePath);

        return ResponseEntity.ok(Map.of("runId", runId));
    }

    /**
     * ETL run status and row counts.
     */
    @GetMapping("/etl/runs/{runId}")
    public ResponseEntity<EtlRunEntity> getEtlRun(@PathVariable UUID runId) {
        log.info("Get ETL run: runId={}", runId);

        return ResponseEntity.ok(etlJobProcessor.getRun(runId));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, String>> handleBadRequest(IllegalArgumentException e) {
        log.warn("Rejected request: {}", e.getMessage());
        return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
    }

    /**
     * Health check endpoint.
     */
    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("OK");
    }
}
