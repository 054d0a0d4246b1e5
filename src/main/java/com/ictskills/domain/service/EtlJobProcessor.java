package com.ictskills.domain.service;

import com.ictskills.domain.model.EtlSummary;
import com.ictskills.infrastructure.persistence.entity.EtlRunEntity;
import com.ictskills.infrastructure.persistence.repository.EtlRunRepository;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.List;
import java.util.UUID;

/**
 * Queued ETL runs.
 *
 * Processing Flow:
 * 1. Client submits a run → row created with PENDING status
 * 2. Client receives the run ID immediately
 * 3. Scheduler picks up pending runs, oldest first
 * 4. Run is marked RUNNING, executed, then COMPLETED or FAILED
 *
 * Runs execute one at a time on the scheduler thread. The ETL itself is
 * transactional, so a FAILED run leaves the skills table untouched.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EtlJobProcessor {

    private final EtlRunRepository etlRunRepository;
    private final EtlService etlService;
    private final MeterRegistry meterRegistry;

    @Value("${app.etl.source-path:data/ITU_DH_SKLS_DIG_CONT.csv}")
    private String defaultSourcePath;

    @Value("${app.etl.data-dir:data}")
    private String dataDirectory;

    @Value("${app.etl.run-on-startup:false}")
    private boolean runOnStartup;

    /**
     * Queue an ETL run. A blank path falls back to the configured survey file;
     * any other path is resolved against the data directory and must stay inside it.
     *
     * @throws IllegalArgumentException if the path escapes the data directory
     */
    public UUID submitRun(String sourcePath) {
        String path = sourcePath == null || sourcePath.isBlank()
                ? defaultSourcePath
                : resolveInDataDirectory(sourcePath);

        EtlRunEntity run = etlRunRepository.save(EtlRunEntity.builder()
                .sourcePath(path)
                .build());

        log.info("ETL run submitted: {} (source: {})", run.getRunId(), path);
        return run.getRunId();
    }

    String resolveInDataDirectory(String sourcePath) {
        Path root = Path.of(dataDirectory).toAbsolutePath().normalize();
        Path resolved;
        try {
            resolved = root.resolve(sourcePath.trim()).normalize();
        } catch (InvalidPathException e) {
            throw new IllegalArgumentException("Invalid source path", e);
        }
        if (!resolved.startsWith(root) || resolved.equals(root)) {
            throw new IllegalArgumentException("Source path must be a file inside the data directory");
        }
        return resolved.toString();
    }

    public EtlRunEntity getRun(UUID runId) {
        return etlRunRepository.findById(runId)
                .orElseThrow(() -> new IllegalArgumentException("ETL run not found: " + runId));
    }

    @EventListener(ApplicationReadyEvent.class)
    public void submitStartupRun() {
        if (runOnStartup) {
            submitRun(null);
        }
    }

    @Scheduled(fixedDelayString = "${app.etl.poll-interval-ms:5000}")
    public void processPendingRuns() {
        try {
            List<EtlRunEntity> pendingRuns = etlRunRepository
                    .findTop10ByStatusOrderByCreatedAtAsc(EtlRunEntity.RunStatus.PENDING);

            if (pendingRuns.isEmpty()) {
                return;
            }

            log.debug("Processing {} pending ETL runs", pendingRuns.size());

            for (EtlRunEntity run : pendingRuns) {
                processRun(run);
            }

        } catch (Exception e) {
            log.error("Error polling pending ETL runs: {}", e.getMessage(), e);
        }
    }

    void processRun(EtlRunEntity run) {
        try {
            log.info("Processing ETL run: {} (source: {})", run.getRunId(), run.getSourcePath());

            run.markStarted();
            etlRunRepository.save(run);

            EtlSummary summary = etlService.run(Path.of(run.getSourcePath()));

            run.markCompleted(summary.getRowsRead(), summary.getRecordsReshaped(), summary.getRecordsUpserted());
            etlRunRepository.save(run);

            Counter.builder("etl.records.upserted")
                    .register(meterRegistry)
                    .increment(summary.getRecordsUpserted());
            countRun("completed");

            log.info("ETL run completed: {} ({} ms)", run.getRunId(), run.getExecutionTimeMs());

        } catch (Exception e) {
            log.error("ETL run {} failed: {}", run.getRunId(), e.getMessage(), e);

            run.markFailed(e.getMessage());
            etlRunRepository.save(run);
            countRun("failed");
        }
    }

    private void countRun(String status) {
        Counter.builder("etl.runs")
                .tag("status", status)
                .register(meterRegistry)
                .increment();
    }
}
