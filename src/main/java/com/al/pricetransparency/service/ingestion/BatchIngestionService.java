package com.al.pricetransparency.service.ingestion;

import com.al.pricetransparency.config.IngestionProperties;
import com.al.pricetransparency.model.enums.IngestionStatus;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.stream.Collectors;

/**
 * Ingests several files in parallel.
 *
 * <p>
 * Each file runs its own pipeline on a pool of {@code app.ingestion.max-concurrent-files}
 * threads; parsers share no state, so files never interfere with each other.
 */
@Service
@Slf4j
public class BatchIngestionService {

    private final IngestionService ingestionService;
    private final ExecutorService executorService;

    @Autowired
    public BatchIngestionService(IngestionService ingestionService, IngestionProperties properties) {
        this.ingestionService = ingestionService;
        int threadPoolSize = Math.max(1, properties.getMaxConcurrentFiles());
        this.executorService = Executors.newFixedThreadPool(threadPoolSize);
        log.info("BatchIngestionService initialized with {} threads", threadPoolSize);
    }

    public List<IngestionStats> ingestFiles(List<Path> files, IngestionOptions options) {
        long startTime = System.currentTimeMillis();
        log.info("Starting batch ingestion: {} files", files.size());

        List<CompletableFuture<IngestionStats>> futures = new ArrayList<>();
        for (Path file : files) {
            futures.add(CompletableFuture
                    .supplyAsync(() -> ingestionService.ingestFile(file, options), executorService)
                    .exceptionally(e -> failed(file, e)));
        }

        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

        List<IngestionStats> results = futures.stream()
                .map(CompletableFuture::join)
                .collect(Collectors.toList());

        long completed = results.stream().filter(s -> s.getStatus() == IngestionStatus.COMPLETED).count();
        long stored = results.stream().mapToLong(IngestionStats::getStoredCharges).sum();
        log.info("Batch ingestion completed: {}/{} files, {} charges stored, {}ms total",
                completed, files.size(), stored, System.currentTimeMillis() - startTime);
        return results;
    }

    public List<IngestionStats> ingestDirectory(Path directory, IngestionOptions options) {
        return ingestFiles(ingestionService.findPriceFiles(directory), options);
    }

    private static IngestionStats failed(Path file, Throwable e) {
        Throwable cause = e instanceof CompletionException && e.getCause() != null ? e.getCause() : e;
        log.error("Ingestion task for {} did not finish: {}", file.getFileName(), cause.getMessage());
        IngestionStats stats = new IngestionStats(null, file.getFileName().toString());
        stats.setStatus(IngestionStatus.FAILED);
        stats.setEndTime(Instant.now());
        stats.recordError(IngestionError.of(IngestionError.Type.UNKNOWN, cause.getMessage(), null));
        return stats;
    }

    @PreDestroy
    public void shutdown() {
        executorService.shutdown();
    }
}
