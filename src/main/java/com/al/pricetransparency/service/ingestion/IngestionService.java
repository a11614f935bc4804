package com.al.pricetransparency.service.ingestion;

import com.al.pricetransparency.config.IngestionProperties;
import com.al.pricetransparency.exception.IngestionException;
import com.al.pricetransparency.exception.UnsupportedFileFormatException;
import com.al.pricetransparency.model.HospitalDocument;
import com.al.pricetransparency.model.ModifierDocument;
import com.al.pricetransparency.model.StandardChargeDocument;
import com.al.pricetransparency.model.enums.IngestionStatus;
import com.al.pricetransparency.model.mrf.ChargeItem;
import com.al.pricetransparency.model.mrf.HospitalMetadata;
import com.al.pricetransparency.model.mrf.ModifierItem;
import com.al.pricetransparency.repository.HospitalRepository;
import com.al.pricetransparency.service.detect.FileMetadata;
import com.al.pricetransparency.service.detect.FormatDetector;
import com.al.pricetransparency.service.normalize.ChargeDocumentBuilder;
import com.al.pricetransparency.service.normalize.ChargeItemValidator;
import com.al.pricetransparency.service.normalize.HospitalContext;
import com.al.pricetransparency.service.normalize.ValidationResult;
import com.al.pricetransparency.service.parser.ChargeFileParserRegistry;
import com.al.pricetransparency.service.parser.ChargeItemListener;
import com.al.pricetransparency.service.parser.ParseOptions;
import com.al.pricetransparency.service.parser.ParseResult;
import com.al.pricetransparency.service.persistence.BulkWriteSummary;
import com.al.pricetransparency.service.persistence.HospitalPriceStore;
import com.al.pricetransparency.util.HospitalIdGenerator;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Runs one hospital file through detection, parsing, normalization and batched persistence.
 *
 * <p>
 * Failures are isolated per file: a file that cannot be detected or read ends with status
 * {@link IngestionStatus#FAILED} in its {@link IngestionStats} and never throws, so a
 * directory run continues with the next file.
 */
@Service
@Slf4j
public class IngestionService {

    static final String MDC_HOSPITAL_ID = "hospitalId";
    static final String UNKNOWN_HOSPITAL = "Unknown Hospital";

    private static final List<String> SUPPORTED_EXTENSIONS = List.of(".json", ".csv");

    private final FormatDetector formatDetector;
    private final ChargeFileParserRegistry parserRegistry;
    private final ChargeDocumentBuilder documentBuilder;
    private final ChargeItemValidator validator;
    private final HospitalPriceStore store;
    private final HospitalRepository hospitalRepository;
    private final IngestionProperties properties;
    private final MeterRegistry meterRegistry;

    @Autowired
    public IngestionService(FormatDetector formatDetector,
            ChargeFileParserRegistry parserRegistry,
            ChargeDocumentBuilder documentBuilder,
            ChargeItemValidator validator,
            HospitalPriceStore store,
            HospitalRepository hospitalRepository,
            IngestionProperties properties,
            MeterRegistry meterRegistry) {
        this.formatDetector = formatDetector;
        this.parserRegistry = parserRegistry;
        this.documentBuilder = documentBuilder;
        this.validator = validator;
        this.store = store;
        this.hospitalRepository = hospitalRepository;
        this.properties = properties;
        this.meterRegistry = meterRegistry;
    }

    public IngestionStats ingestFile(Path path, IngestionOptions options) {
        String hospitalId = HospitalIdGenerator.fromPath(path);
        IngestionStats stats = new IngestionStats(hospitalId, path.getFileName().toString());
        Timer.Sample sample = Timer.start(meterRegistry);
        MDC.put(MDC_HOSPITAL_ID, hospitalId);
        try {
            FileMetadata file = formatDetector.detect(path);
            stats.setFormat(file.getFormat());
            if (file.getRawVersion() != null) {
                stats.setVersion(file.getRawVersion());
            }
            if (file.getEstimatedRecordCount() != null) {
                stats.setTotalCharges(file.getEstimatedRecordCount());
            }
            log.info("Processing {}: format={}, size={} bytes, version={}, estimated records={}",
                    path.getFileName(), file.getFormat(), file.getSizeBytes(), file.getVersion().getLabel(),
                    file.getEstimatedRecordCount());

            if (options.isSkipExisting() && !options.isDryRun() && hospitalRepository.existsByHospitalId(hospitalId)) {
                log.info("Skipping {} - hospital already exists", hospitalId);
                stats.setSkippedExisting(true);
                return complete(stats, options);
            }
            if (options.isReplaceExisting() && !options.isDryRun()) {
                store.deleteHospitalCharges(hospitalId);
                store.deleteHospitalModifiers(hospitalId);
            }

            Pipeline pipeline = new Pipeline(stats, options, file);
            ParseOptions parseOptions = ParseOptions.builder()
                    .maxItems(options.getMaxItems())
                    .progressInterval(properties.getProgressInterval())
                    .build();
            ParseResult result = parserRegistry.getParser(file.getFormat()).parse(file, pipeline, parseOptions);
            pipeline.flushCharges();
            pipeline.flushModifiers();

            HospitalMetadata metadata = result.getMetadata();
            stats.setHospitalName(metadata.getHospitalName());
            if (metadata.getVersion() != null) {
                stats.setVersion(metadata.getVersion());
            }
            stats.setTotalCharges(result.getChargeCount());
            stats.setSkippedCharges(stats.getSkippedCharges() + result.getSkippedCount());

            if (!options.isDryRun()) {
                store.upsertHospital(toHospitalDocument(hospitalId, path, metadata, result));
            }
            return complete(stats, options);
        } catch (UnsupportedFileFormatException | IOException e) {
            return fail(stats, IngestionError.Type.PARSE, e);
        } catch (DataAccessException e) {
            return fail(stats, IngestionError.Type.DATABASE, e);
        } catch (RuntimeException e) {
            return fail(stats, IngestionError.Type.UNKNOWN, e);
        } finally {
            sample.stop(meterRegistry.timer("ingestion.file.time", "status", stats.getStatus().name()));
            MDC.remove(MDC_HOSPITAL_ID);
        }
    }

    /**
     * Ingests every {@code .json} and {@code .csv} file of a directory, one after another in name order.
     */
    public List<IngestionStats> ingestDirectory(Path directory, IngestionOptions options) {
        List<Path> files = findPriceFiles(directory);
        log.info("Found {} file(s) to process in {}", files.size(), directory);
        List<IngestionStats> results = new ArrayList<>();
        for (Path file : files) {
            results.add(ingestFile(file, options));
        }
        return results;
    }

    public List<Path> findPriceFiles(Path directory) {
        if (!Files.isDirectory(directory)) {
            throw new IngestionException("Directory not found: " + directory);
        }
        try (Stream<Path> entries = Files.list(directory)) {
            return entries
                    .filter(Files::isRegularFile)
                    .filter(IngestionService::isSupported)
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new IngestionException("Failed to list " + directory, e);
        }
    }

    private static boolean isSupported(Path path) {
        String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        return SUPPORTED_EXTENSIONS.stream().anyMatch(name::endsWith);
    }

    private IngestionStats complete(IngestionStats stats, IngestionOptions options) {
        stats.setStatus(IngestionStatus.COMPLETED);
        stats.setEndTime(Instant.now());
        long durationMs = Duration.between(stats.getStartTime(), stats.getEndTime()).toMillis();
        int batchSize = Math.max(1, options.getBatchSize());
        long batches = (stats.getProcessedCharges() + batchSize - 1) / batchSize;
        stats.setAvgBatchTimeMs(batches > 0 ? (double) durationMs / batches : 0);
        meterRegistry.counter("ingestion.files", "status", "completed").increment();

        log.info("Completed {} in {}ms: {} inserted, {} updated, {} failed, {} invalid, {} modifiers",
                stats.getSourceFile(), durationMs, stats.getInsertedCharges(), stats.getUpdatedCharges(),
                stats.getFailedCharges(), stats.getInvalidCharges(), stats.getProcessedModifiers());
        return stats;
    }

    private IngestionStats fail(IngestionStats stats, IngestionError.Type type, Exception e) {
        log.error("Ingestion of {} failed: {}", stats.getSourceFile(), e.getMessage(), e);
        stats.setStatus(IngestionStatus.FAILED);
        stats.setEndTime(Instant.now());
        stats.recordError(IngestionError.of(type, e.getMessage(), null));
        meterRegistry.counter("ingestion.files", "status", "failed").increment();
        return stats;
    }

    private static HospitalDocument toHospitalDocument(String hospitalId, Path path, HospitalMetadata metadata,
            ParseResult result) {
        return HospitalDocument.builder()
                .hospitalId(hospitalId)
                .hospitalName(metadata.getHospitalName())
                .addresses(metadata.getAddresses())
                .locations(metadata.getLocations())
                .npiNumbers(metadata.getNpiNumbers())
                .licenseNumber(metadata.getLicenseNumber())
                .licenseState(metadata.getLicenseState())
                .version(metadata.getVersion())
                .lastUpdatedOn(metadata.getLastUpdatedOn())
                .attestationText(metadata.getAttestationText())
                .attestationConfirmed(metadata.isAttestationConfirmed())
                .attesterName(metadata.getAttesterName())
                .financialAidPolicy(metadata.getFinancialAidPolicy())
                .generalContractProvisions(metadata.getGeneralContractProvisions())
                .sourceFile(path.getFileName().toString())
                .ingestedAt(Instant.now())
                .chargeCount(result.getChargeCount())
                .modifierCount(result.getModifierCount())
                .build();
    }

    /**
     * Parser callbacks of one file: validates, normalizes and buffers documents until a batch is full.
     */
    private final class Pipeline implements ChargeItemListener {
        private final IngestionStats stats;
        private final IngestionOptions options;
        private final Instant ingestedAt = Instant.now();
        private final List<StandardChargeDocument> chargeBatch = new ArrayList<>();
        private final List<ModifierDocument> modifierBatch = new ArrayList<>();
        private HospitalContext context;

        Pipeline(IngestionStats stats, IngestionOptions options, FileMetadata file) {
            this.stats = stats;
            this.options = options;
            this.context = HospitalContext.builder()
                    .hospitalId(stats.getHospitalId())
                    .hospitalName(UNKNOWN_HOSPITAL)
                    .sourceVersion(file.getRawVersion())
                    .build();
        }

        @Override
        public void onMetadata(HospitalMetadata metadata) {
            context = HospitalContext.builder()
                    .hospitalId(stats.getHospitalId())
                    .hospitalName(metadata.getHospitalName() != null ? metadata.getHospitalName() : UNKNOWN_HOSPITAL)
                    .sourceVersion(metadata.getVersion() != null ? metadata.getVersion() : context.getSourceVersion())
                    .build();
            stats.setHospitalName(context.getHospitalName());
        }

        @Override
        public void onChargeItem(ChargeItem item, long index) {
            stats.setProcessedCharges(stats.getProcessedCharges() + 1);

            ValidationResult validation = validator.validate(item);
            if (!validation.isValid()) {
                stats.setInvalidCharges(stats.getInvalidCharges() + 1);
                stats.recordError(IngestionError.of(IngestionError.Type.VALIDATION,
                        String.join("; ", validation.getErrors()), index));
                log.debug("Item {} failed validation: {}", index, validation.getErrors());
                if (properties.isSkipInvalid()) {
                    stats.setSkippedCharges(stats.getSkippedCharges() + 1);
                    return;
                }
            }

            chargeBatch.addAll(documentBuilder.toDocuments(item, context, ingestedAt));
            if (chargeBatch.size() >= options.getBatchSize()) {
                flushCharges();
            }
        }

        @Override
        public void onModifier(ModifierItem modifier, long index) {
            stats.setTotalModifiers(stats.getTotalModifiers() + 1);
            modifierBatch.add(ModifierDocument.builder()
                    .hospitalId(stats.getHospitalId())
                    .code(modifier.getCode())
                    .description(modifier.getDescription())
                    .setting(modifier.getSetting())
                    .payerInformation(modifier.getPayerInformation())
                    .ingestedAt(ingestedAt)
                    .build());
            if (modifierBatch.size() >= options.getBatchSize()) {
                flushModifiers();
            }
        }

        @Override
        public void onParseError(long index, String reason) {
            stats.setFailedCharges(stats.getFailedCharges() + 1);
            stats.recordError(IngestionError.of(IngestionError.Type.PARSE, reason, index));
        }

        @Override
        public void onProgress(long processed, Long estimatedTotal, long bytesRead) {
            log.info("Progress: {} / {} items ({} bytes read)", processed,
                    estimatedTotal != null ? estimatedTotal : "?", bytesRead);
        }

        void flushCharges() {
            if (chargeBatch.isEmpty()) {
                return;
            }
            if (options.isDryRun()) {
                stats.setInsertedCharges(stats.getInsertedCharges() + chargeBatch.size());
            } else {
                BulkWriteSummary summary = store.writeCharges(new ArrayList<>(chargeBatch), options.isUpsert());
                stats.setInsertedCharges(stats.getInsertedCharges() + summary.getInserted());
                stats.setUpdatedCharges(stats.getUpdatedCharges() + summary.getModified());
                stats.setFailedCharges(stats.getFailedCharges() + summary.getErrors());
                if (summary.getErrors() > 0) {
                    stats.recordError(IngestionError.of(IngestionError.Type.DATABASE,
                            summary.getErrors() + " documents rejected by bulk write", null));
                    meterRegistry.counter("ingestion.charges", "status", "failed").increment(summary.getErrors());
                }
                meterRegistry.counter("ingestion.charges", "status", "stored")
                        .increment(summary.getInserted() + summary.getModified());
            }
            chargeBatch.clear();
        }

        void flushModifiers() {
            if (modifierBatch.isEmpty()) {
                return;
            }
            if (options.isDryRun()) {
                stats.setProcessedModifiers(stats.getProcessedModifiers() + modifierBatch.size());
            } else {
                BulkWriteSummary summary = store.upsertModifiers(new ArrayList<>(modifierBatch));
                stats.setProcessedModifiers(stats.getProcessedModifiers() + summary.getInserted()
                        + summary.getModified());
            }
            modifierBatch.clear();
        }
    }
}
