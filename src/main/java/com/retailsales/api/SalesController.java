package com.retailsales.api;

import com.retailsales.domain.model.FilterOptions;
import com.retailsales.domain.model.SalesPage;
import com.retailsales.domain.model.SalesQueryRequest;
import com.retailsales.domain.model.SalesStats;
import com.retailsales.domain.service.ImportJobProcessor;
import com.retailsales.domain.service.SalesQueryService;
import com.retailsales.domain.service.SalesStatsService;
import com.retailsales.domain.service.UploadTracker;
import com.retailsales.infrastructure.persistence.entity.CsvUploadEntity;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.Locale;
import java.util.UUID;

/**
 * REST API for retail sales.
 *
 * Endpoints:
 * - GET /api/v1/sales - Search, filter, sort and page transactions
 * - GET /api/v1/sales/filters - Distinct values for filter controls
 * - GET /api/v1/sales/stats - Units, gross amount and discount for a filter
 * - POST /api/v1/sales/uploads - Import a CSV file and wait for the summary
 * - POST /api/v1/sales/uploads/async - Import a CSV file in the background
 * - GET /api/v1/sales/uploads - Recent uploads
 * - GET /api/v1/sales/uploads/{uploadId} - Upload status and counts
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/sales")
@RequiredArgsConstructor
public class SalesController {

    static final String UPLOADED_BY_HEADER = "X-Uploaded-By";

    private final SalesQueryService queryService;
    private final SalesStatsService statsService;
    private final ImportJobProcessor importJobProcessor;
    private final UploadTracker uploadTracker;

    /**
     * Query transactions.
     *
     * GET /api/v1/sales?search=xxx&regions=North&regions=East&ageMin=18&ageMax=25&sortBy=quantity&sortOrder=desc&page=2&pageSize=10
     *
     * Response:
     * - records: Transactions on the page
     * - pagination: page, pageSize, totalCount, totalPages
     * - queryTimeMs: Query execution time
     *
     * A storage timeout yields an empty page, not an error.
     */
    @GetMapping
    public ResponseEntity<SalesPage> queryTransactions(
            @Valid SalesFilterParams filterParams,
            @RequestParam(required = false) String search,
            @RequestParam(required = false) String sortBy,
            @RequestParam(required = false) String sortOrder,
            @RequestParam(required = false) Integer page,
            @RequestParam(required = false) Integer pageSize) {

        log.info("Query transactions: search={}, sortBy={}, sortOrder={}, page={}", search, sortBy, sortOrder, page);

        SalesQueryRequest request = SalesQueryRequest.builder()
                .search(search)
                .filter(filterParams.toFilter())
                .sortBy(sortBy)
                .sortOrder(sortOrder)
                .page(page)
                .pageSize(pageSize)
                .build();

        return ResponseEntity.ok(queryService.queryTransactions(request));
    }

    @GetMapping("/filters")
    public ResponseEntity<FilterOptions> getFilterOptions() {
        return ResponseEntity.ok(queryService.getFilterOptions());
    }

    /**
     * Aggregate stats. The search term does not apply here.
     */
    @GetMapping("/stats")
    public ResponseEntity<SalesStats> getStats(@Valid SalesFilterParams filterParams) {
        return ResponseEntity.ok(statsService.getStats(filterParams.toFilter()));
    }

    /**
     * Import a CSV file synchronously.
     *
     * POST /api/v1/sales/uploads (multipart, part name "file")
     *
     * Response: {success, totalRecords, imported, errors} plus the upload id and status.
     */
    @PostMapping(value = "/uploads", consumes = "multipart/form-data")
    public ResponseEntity<UploadResult> upload(
            @RequestParam("file") MultipartFile file,
            @RequestHeader(value = UPLOADED_BY_HEADER, required = false) String uploadedBy) {

        log.info("Upload: file={}, size={}, uploadedBy={}", file.getOriginalFilename(), file.getSize(), uploadedBy);

        CsvUploadEntity upload = importJobProcessor.importNow(
                file.getOriginalFilename(), readCsv(file), uploadedBy);

        return ResponseEntity.ok(UploadResult.from(upload));
    }

    /**
     * Import a CSV file in the background.
     *
     * Response (202): the PROCESSING upload record; poll /uploads/{uploadId}.
     */
    @PostMapping(value = "/uploads/async", consumes = "multipart/form-data")
    public ResponseEntity<CsvUploadEntity> uploadAsync(
            @RequestParam("file") MultipartFile file,
            @RequestHeader(value = UPLOADED_BY_HEADER, required = false) String uploadedBy) {

        log.info("Async upload: file={}, size={}, uploadedBy={}", file.getOriginalFilename(), file.getSize(), uploadedBy);

        byte[] content = readCsv(file);
        CsvUploadEntity upload = importJobProcessor.submit(file.getOriginalFilename(), content, uploadedBy);
        importJobProcessor.processAsync(upload.getUploadId(), content);

        return ResponseEntity.status(HttpStatus.ACCEPTED).body(upload);
    }

    @GetMapping("/uploads")
    public ResponseEntity<List<CsvUploadEntity>> listUploads() {
        return ResponseEntity.ok(uploadTracker.listRecent());
    }

    @GetMapping("/uploads/{uploadId}")
    public ResponseEntity<CsvUploadEntity> getUpload(@PathVariable UUID uploadId) {
        return ResponseEntity.ok(uploadTracker.get(uploadId));
    }

    static byte[] readCsv(MultipartFile file) {
        if (file == null || file.isEmpty()) {
            throw new InvalidUploadException("No CSV file uploaded");
        }
        String name = file.getOriginalFilename();
        String contentType = file.getContentType();
        boolean csvName = name != null && name.toLowerCase(Locale.ROOT).endsWith(".csv");
        boolean csvType = contentType != null
                && (contentType.startsWith("text/csv") || contentType.startsWith("application/vnd.ms-excel"));
        if (!csvName && !csvType) {
            throw new InvalidUploadException("Only CSV files are accepted: " + name);
        }
        try {
            return file.getBytes();
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read uploaded file " + name, e);
        }
    }
}
