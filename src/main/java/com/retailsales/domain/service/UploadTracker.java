package com.retailsales.domain.service;

import com.retailsales.domain.model.ImportProgress;
import com.retailsales.domain.model.ImportSummary;
import com.retailsales.infrastructure.persistence.entity.CsvUploadEntity;
import com.retailsales.infrastructure.persistence.repository.CsvUploadRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

/**
 * Lifecycle of CSV upload records: PROCESSING, then COMPLETED or FAILED.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class UploadTracker {

    static final String INTERRUPTED_MESSAGE = "Interrupted by application restart";

    private final CsvUploadRepository uploadRepository;

    @Transactional
    public CsvUploadEntity begin(String fileName, long fileSize, String uploadedBy) {
        CsvUploadEntity upload = CsvUploadEntity.builder()
                .fileName(fileName == null || fileName.isBlank() ? "upload.csv" : fileName)
                .fileSize(fileSize)
                .uploadedBy(uploadedBy)
                .build();

        upload = uploadRepository.save(upload);

        log.info("Upload started: {} ({}, {} bytes)", upload.getUploadId(), upload.getFileName(), fileSize);

        return upload;
    }

    @Transactional
    public void recordProgress(UUID uploadId, ImportProgress progress) {
        CsvUploadEntity upload = get(uploadId);
        upload.recordProgress(progress.getProcessed(), progress.getTotal(),
                progress.getImported(), progress.getErrors());
        uploadRepository.save(upload);
    }

    @Transactional
    public CsvUploadEntity complete(UUID uploadId, ImportSummary summary) {
        CsvUploadEntity upload = get(uploadId);
        upload.markCompleted(summary.getTotalRecords(), summary.getImported(), summary.getErrors());
        upload = uploadRepository.save(upload);

        log.info("Upload completed: {} ({} imported, {} errors, {} ms)",
                uploadId, summary.getImported(), summary.getErrors(), upload.getExecutionTimeMs());

        return upload;
    }

    @Transactional
    public CsvUploadEntity fail(UUID uploadId, String errorMessage) {
        CsvUploadEntity upload = get(uploadId);
        upload.markFailed(errorMessage);
        upload = uploadRepository.save(upload);

        log.warn("Upload failed: {} ({})", uploadId, errorMessage);

        return upload;
    }

    @Transactional(readOnly = true)
    public CsvUploadEntity get(UUID uploadId) {
        return uploadRepository.findById(uploadId)
                .orElseThrow(() -> new UploadNotFoundException(uploadId));
    }

    @Transactional(readOnly = true)
    public List<CsvUploadEntity> listRecent() {
        return uploadRepository.findTop20ByOrderByUploadedAtDesc();
    }

    /**
     * Uploads still PROCESSING at startup lost their worker with the previous
     * process and will never finish.
     */
    @EventListener(ApplicationReadyEvent.class)
    @Transactional
    public void failInterruptedUploads() {
        List<CsvUploadEntity> stale = uploadRepository
                .findByStatusOrderByUploadedAtAsc(CsvUploadEntity.UploadStatus.PROCESSING);

        for (CsvUploadEntity upload : stale) {
            upload.markFailed(INTERRUPTED_MESSAGE);
        }
        uploadRepository.saveAll(stale);

        if (!stale.isEmpty()) {
            log.warn("Marked {} interrupted uploads as failed", stale.size());
        }
    }
}
