package com.al.pricetransparency.controller;

import com.al.pricetransparency.config.CollectionInitializer;
import com.al.pricetransparency.config.IngestionProperties;
import com.al.pricetransparency.dto.IngestionRequest;
import com.al.pricetransparency.service.ingestion.BatchIngestionService;
import com.al.pricetransparency.service.ingestion.IngestionOptions;
import com.al.pricetransparency.service.ingestion.IngestionService;
import com.al.pricetransparency.service.ingestion.IngestionStats;
import com.al.pricetransparency.service.persistence.CollectionStats;
import com.al.pricetransparency.service.persistence.HospitalPriceStore;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.nio.file.Path;
import java.util.List;

@RestController
@RequestMapping("/api/ingestion")
@Slf4j
@Tag(name = "Ingestion", description = "Hospital price file ingestion")
public class IngestionController {

    private final IngestionService ingestionService;
    private final BatchIngestionService batchIngestionService;
    private final HospitalPriceStore store;
    private final CollectionInitializer collectionInitializer;
    private final IngestionProperties properties;

    @Autowired
    public IngestionController(IngestionService ingestionService,
            BatchIngestionService batchIngestionService,
            HospitalPriceStore store,
            CollectionInitializer collectionInitializer,
            IngestionProperties properties) {
        this.ingestionService = ingestionService;
        this.batchIngestionService = batchIngestionService;
        this.store = store;
        this.collectionInitializer = collectionInitializer;
        this.properties = properties;
    }

    @Operation(summary = "Ingest a file or every price file of a directory")
    @PostMapping("/files")
    public ResponseEntity<List<IngestionStats>> ingest(@Valid @RequestBody IngestionRequest request) {
        boolean hasFile = request.getFile() != null && !request.getFile().isBlank();
        boolean hasDirectory = request.getDirectory() != null && !request.getDirectory().isBlank();
        if (hasFile == hasDirectory) {
            throw new IllegalArgumentException("Exactly one of 'file' and 'directory' is required");
        }

        IngestionOptions options = IngestionOptions.builder()
                .batchSize(request.getBatchSize() != null ? request.getBatchSize() : properties.getBatchSize())
                .dryRun(request.isDryRun())
                .maxItems(request.getMaxItems())
                .skipExisting(request.isSkipExisting())
                .replaceExisting(request.isReplaceExisting())
                .build();

        if (!options.isDryRun()) {
            collectionInitializer.initialize();
        }

        if (hasFile) {
            log.info("Ingestion requested for file {}", request.getFile());
            return ResponseEntity.ok(List.of(ingestionService.ingestFile(Path.of(request.getFile()), options)));
        }
        log.info("Ingestion requested for directory {} (parallel={})", request.getDirectory(), request.isParallel());
        Path directory = Path.of(request.getDirectory());
        List<IngestionStats> results = request.isParallel()
                ? batchIngestionService.ingestDirectory(directory, options)
                : ingestionService.ingestDirectory(directory, options);
        return ResponseEntity.ok(results);
    }

    @Operation(summary = "Document counts of the hospital, charge and modifier collections")
    @GetMapping("/stats")
    public ResponseEntity<CollectionStats> stats() {
        return ResponseEntity.ok(store.getCollectionStats());
    }

    @Operation(summary = "Create the collection indexes")
    @PostMapping("/init")
    public ResponseEntity<Void> initialize() {
        collectionInitializer.initialize();
        return ResponseEntity.noContent().build();
    }
}
