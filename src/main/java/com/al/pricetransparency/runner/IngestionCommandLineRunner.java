package com.al.pricetransparency.runner;

import com.al.pricetransparency.config.CollectionInitializer;
import com.al.pricetransparency.config.IngestionProperties;
import com.al.pricetransparency.model.enums.IngestionStatus;
import com.al.pricetransparency.service.ingestion.IngestionOptions;
import com.al.pricetransparency.service.ingestion.IngestionService;
import com.al.pricetransparency.service.ingestion.IngestionStats;
import com.al.pricetransparency.service.persistence.CollectionStats;
import com.al.pricetransparency.service.persistence.HospitalPriceStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.List;

/**
 * Batch ingestion from the command line, active with {@code app.ingestion.cli.enabled=true}.
 */
@Component
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "app.ingestion.cli", name = "enabled", havingValue = "true")
public class IngestionCommandLineRunner implements ApplicationRunner {

    static final String USAGE = """
            Hospital Price Transparency Ingestion

            Options:
              --file <path>         Ingest a specific file
              --dir <path>          Ingest all .json/.csv files in a directory (default: app.ingestion.prices-dir)
              --batch-size <n>      Batch size for database writes
              --dry-run             Parse files without writing to the database
              --init-only           Only create collection indexes
              --stats               Show collection statistics
              --max-items <n>       Maximum items to process per file
              --skip-existing       Skip hospitals that already exist
              --replace-existing    Delete a hospital's charges before ingesting it again
              --help                Show this help message
            """;

    private final IngestionService ingestionService;
    private final HospitalPriceStore store;
    private final CollectionInitializer collectionInitializer;
    private final IngestionProperties properties;

    @Override
    public void run(ApplicationArguments applicationArguments) {
        CliArguments args = CliArguments.parse(applicationArguments.getSourceArgs());
        if (args.isHelp()) {
            log.info("\n{}", USAGE);
            return;
        }
        if (args.isStats()) {
            logCollectionStats("Collection statistics");
            return;
        }
        if (!args.isDryRun()) {
            collectionInitializer.initialize();
        }
        if (args.isInitOnly()) {
            log.info("Collections initialized. Exiting.");
            return;
        }

        IngestionOptions options = IngestionOptions.builder()
                .batchSize(args.getBatchSize() != null ? args.getBatchSize() : properties.getBatchSize())
                .dryRun(args.isDryRun())
                .maxItems(args.getMaxItems())
                .skipExisting(args.isSkipExisting())
                .replaceExisting(args.isReplaceExisting())
                .build();
        if (options.isDryRun()) {
            log.info("DRY RUN - no data will be written to the database");
        }

        long start = System.currentTimeMillis();
        List<IngestionStats> results = args.getFile() != null
                ? List.of(ingestionService.ingestFile(Path.of(args.getFile()), options))
                : ingestionService.ingestDirectory(
                        Path.of(args.getDir() != null ? args.getDir() : properties.getPricesDir()), options);
        summarize(results, System.currentTimeMillis() - start);

        if (!options.isDryRun()) {
            logCollectionStats("Database totals");
        }
    }

    private void summarize(List<IngestionStats> results, long durationMs) {
        long completed = results.stream().filter(s -> s.getStatus() == IngestionStatus.COMPLETED).count();
        long stored = results.stream().mapToLong(IngestionStats::getStoredCharges).sum();
        long failed = results.stream().mapToLong(IngestionStats::getFailedCharges).sum();
        long perSecond = durationMs > 0 ? Math.round(stored / (durationMs / 1000.0)) : stored;

        log.info("Files processed: {}/{}", completed, results.size());
        log.info("Total charges: {} in {}ms ({} charges/sec)", stored, durationMs, perSecond);
        if (failed > 0) {
            log.warn("Total failed: {}", failed);
        }
        for (IngestionStats stats : results) {
            if (stats.getStatus() == IngestionStatus.FAILED) {
                log.warn("Failed: {} - {}", stats.getSourceFile(),
                        stats.getErrors().isEmpty() ? "unknown error" : stats.getErrors().get(0).getMessage());
            }
        }
    }

    private void logCollectionStats(String title) {
        CollectionStats stats = store.getCollectionStats();
        log.info("{}: hospitals={}, charges={}, modifiers={}", title, stats.getHospitals(), stats.getCharges(),
                stats.getModifiers());
    }
}
