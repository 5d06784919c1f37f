package com.retailsales.api;

import com.retailsales.infrastructure.persistence.entity.CsvUploadEntity;
import lombok.Builder;
import lombok.Value;

import java.util.UUID;

/**
 * Response of a synchronous upload: the ingestion summary plus the upload it was tracked under.
 */
@Value
@Builder
public class UploadResult {

    boolean success;
    int totalRecords;
    int imported;
    int errors;

    UUID uploadId;
    String fileName;
    CsvUploadEntity.UploadStatus status;
    long executionTimeMs;

    public static UploadResult from(CsvUploadEntity upload) {
        return UploadResult.builder()
                .success(upload.getStatus() == CsvUploadEntity.UploadStatus.COMPLETED)
                .totalRecords(upload.getTotalRecords())
                .imported(upload.getImportedRecords())
                .errors(upload.getFailedRecords())
                .uploadId(upload.getUploadId())
                .fileName(upload.getFileName())
                .status(upload.getStatus())
                .executionTimeMs(upload.getExecutionTimeMs())
                .build();
    }
}
