package com.retailsales.infrastructure.persistence.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Entity tracking one CSV ingestion.
 *
 * Created as PROCESSING before the pipeline starts, then moved to
 * COMPLETED (even when some rows failed) or FAILED with an error message.
 * Async uploads also write running counts here so callers can poll progress.
 */
@Entity
@Table(name = "csv_uploads", indexes = {
    @Index(name = "idx_upload_status", columnList = "status"),
    @Index(name = "idx_upload_uploaded_at", columnList = "uploadedAt")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CsvUploadEntity {

    @Id
    @Column(columnDefinition = "UUID")
    private UUID uploadId;

    @Column(nullable = false)
    private String fileName;

    @Column(nullable = false)
    private long fileSize;

    @Column(nullable = false)
    private int totalRecords;

    @Column(nullable = false)
    private int processedRecords;

    @Column(nullable = false)
    private int importedRecords;

    @Column(nullable = false)
    private int failedRecords;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private UploadStatus status = UploadStatus.PROCESSING;

    @Column(length = 1000)
    private String errorMessage;

    @Column(length = 200)
    private String uploadedBy;

    @Column(nullable = false)
    private Instant uploadedAt;

    @Column
    private Instant completedAt;

    public enum UploadStatus {
        PROCESSING,
        COMPLETED,
        FAILED
    }

    @PrePersist
    protected void onCreate() {
        if (uploadId == null) {
            uploadId = UUID.randomUUID();
        }
        if (uploadedAt == null) {
            uploadedAt = Instant.now();
        }
    }

    public void recordProgress(int processed, int total, int imported, int failed) {
        this.processedRecords = processed;
        this.totalRecords = total;
        this.importedRecords = imported;
        this.failedRecords = failed;
    }

    public void markCompleted(int total, int imported, int failed) {
        this.status = UploadStatus.COMPLETED;
        this.totalRecords = total;
        this.processedRecords = total;
        this.importedRecords = imported;
        this.failedRecords = failed;
        this.completedAt = Instant.now();
    }

    public void markFailed(String error) {
        this.status = UploadStatus.FAILED;
        this.errorMessage = error != null && error.length() > 1000 ? error.substring(0, 1000) : error;
        this.completedAt = Instant.now();
    }

    public long getExecutionTimeMs() {
        if (uploadedAt == null || completedAt == null) {
            return 0;
        }
        return completedAt.toEpochMilli() - uploadedAt.toEpochMilli();
    }
}
