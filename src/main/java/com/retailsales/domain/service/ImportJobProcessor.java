package com.retailsales.domain.service;

import com.retailsales.domain.ingest.SalesImportService;
import com.retailsales.domain.model.ImportProgressListener;
import com.retailsales.domain.model.ImportSummary;
import com.retailsales.infrastructure.persistence.entity.CsvUploadEntity;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.util.UUID;

/**
 * Runs CSV imports against a tracked upload record.
 *
 * Synchronous uploads block until the import finishes and return the final
 * record; a fatal failure is recorded and then rethrown to the caller.
 * Async uploads return the PROCESSING record immediately. The import then
 * runs on the task executor and persists progress after every batch, so
 * callers poll the upload for status.
 *
 * Failure Handling:
 * - Malformed CSV or lost storage: upload marked FAILED with the message
 * - Row and batch failures: counted, upload still COMPLETED
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ImportJobProcessor {

    private final SalesImportService importService;
    private final UploadTracker uploadTracker;

    public CsvUploadEntity importNow(String fileName, byte[] content, String uploadedBy) {
        CsvUploadEntity upload = uploadTracker.begin(fileName, content.length, uploadedBy);
        return runTracked(upload.getUploadId(), content, ImportProgressListener.NONE, true);
    }

    public CsvUploadEntity submit(String fileName, byte[] content, String uploadedBy) {
        return uploadTracker.begin(fileName, content.length, uploadedBy);
    }

    /**
     * Import for an upload created by {@link #submit}.
     *
     * Must be invoked through the Spring proxy to run off the caller's thread.
     */
    @Async
    public void processAsync(UUID uploadId, byte[] content) {
        log.info("Processing async upload: {}", uploadId);
        runTracked(uploadId, content, progress -> uploadTracker.recordProgress(uploadId, progress), false);
    }

    private CsvUploadEntity runTracked(UUID uploadId, byte[] content, ImportProgressListener listener,
                                       boolean rethrow) {
        ImportSummary summary;
        try {
            summary = importService.importBuffer(content, listener);
        } catch (RuntimeException e) {
            log.error("Import for upload {} failed: {}", uploadId, e.getMessage(), e);
            CsvUploadEntity failed = uploadTracker.fail(uploadId, e.getMessage());
            if (rethrow) {
                throw e;
            }
            return failed;
        }
        return uploadTracker.complete(uploadId, summary);
    }
}
