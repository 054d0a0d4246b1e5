package com.ictskills.infrastructure.persistence.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Entity for tracking ETL runs.
 *
 * A run is submitted as PENDING and picked up by the scheduled processor.
 * Clients poll this row for status and row counts.
 */
@Entity
@Table(name = "etl_runs", indexes = {
    @Index(name = "idx_etl_status", columnList = "status"),
    @Index(name = "idx_etl_created_at", columnList = "createdAt")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EtlRunEntity {

    @Id
    @Column(columnDefinition = "UUID")
    private UUID runId;

    @Column(nullable = false, length = 500)
    private String sourcePath;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private RunStatus status = RunStatus.PENDING;

    @Column
    private Integer rowsRead;

    @Column
    private Integer recordsReshaped;

    @Column
    private Integer recordsUpserted;

    @Column(length = 500)
    private String errorMessage;

    @Column(nullable = false)
    private Instant createdAt;

    @Column
    private Instant startedAt;

    @Column
    private Instant completedAt;

    public enum RunStatus {
        PENDING,
        RUNNING,
        COMPLETED,
        FAILED
    }

    @PrePersist
    protected void onCreate() {
        if (runId == null) {
            runId = UUID.randomUUID();
        }
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }

    public void markStarted() {
        this.status = RunStatus.RUNNING;
        this.startedAt = Instant.now();
    }

    public void markCompleted(int rowsRead, int recordsReshaped, int recordsUpserted) {
        this.status = RunStatus.COMPLETED;
        this.rowsRead = rowsRead;
        this.recordsReshaped = recordsReshaped;
        this.recordsUpserted = recordsUpserted;
        this.completedAt = Instant.now();
    }

    public void markFailed(String error) {
        this.status = RunStatus.FAILED;
        this.errorMessage = error != null && error.length() > 500 ? error.substring(0, 500) : error;
        this.completedAt = Instant.now();
    }

    public long getExecutionTimeMs() {
        if (startedAt == null || completedAt == null) {
            return 0;
        }
        return completedAt.toEpochMilli() - startedAt.toEpochMilli();
    }
}
