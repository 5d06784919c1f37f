package com.retailsales.domain.service;

import com.retailsales.domain.ingest.SalesImportService;
import com.retailsales.domain.model.ImportSummary;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Imports a CSV file from disk at startup when app.import.seed-file is set.
 *
 * Already imported transactions are skipped, so a restart with the same
 * seed file adds nothing.
 */
@Slf4j
@Component
public class SeedImportRunner implements ApplicationRunner {

    private final SalesImportService importService;
    private final String seedFile;

    public SeedImportRunner(SalesImportService importService,
                            @Value("${app.import.seed-file:}") String seedFile) {
        this.importService = importService;
        this.seedFile = seedFile;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (seedFile == null || seedFile.isBlank()) {
            return;
        }

        Path path = Path.of(seedFile);
        if (!Files.isRegularFile(path)) {
            log.warn("Seed file {} not found, skipping seed import", path);
            return;
        }

        log.info("Seeding sales data from {}", path);
        ImportSummary summary = importService.importFile(path, progress ->
                log.info("Seed import progress: {}/{} ({} imported, {} errors)",
                        progress.getProcessed(), progress.getTotal(), progress.getImported(), progress.getErrors()));

        log.info("Seed import done: {} records, {} imported, {} errors",
                summary.getTotalRecords(), summary.getImported(), summary.getErrors());
    }
}
