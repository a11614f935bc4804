package com.al.pricetransparency.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

/**
 * Configuration for MRF parsing and the ingestion pipeline.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "app.ingestion")
public class IngestionProperties {

    /**
     * Directory scanned when the CLI is started with {@code --dir} and no path.
     */
    private String pricesDir = "./public_prices";

    /**
     * JSON files at or above this size are scanned in chunks instead of parsed as one tree.
     */
    private long streamingThresholdBytes = 50L * 1024 * 1024;

    /**
     * Characters read per chunk by the streaming scanner.
     */
    private int chunkSizeChars = 64 * 1024;

    /**
     * Largest single array element the scanner will buffer. Larger elements are skipped.
     */
    private int maxElementChars = 16 * 1024 * 1024;

    /**
     * Bytes read from the start of a file for format and metadata sniffing.
     */
    private int headerPrefixBytes = 10 * 1024;

    private int batchSize = 500;

    /**
     * Progress is logged every this many items.
     */
    private int progressInterval = 1000;

    private int maxConcurrentFiles = 2;

    /**
     * Whether items failing validation are dropped instead of persisted.
     */
    private boolean skipInvalid = false;

    /**
     * Code systems preferred, in order, when choosing the primary code of an item.
     */
    private List<String> primaryCodeTypes = new ArrayList<>(List.of("CPT", "HCPCS", "MS-DRG", "DRG", "APC"));

    private Cli cli = new Cli();

    @Data
    public static class Cli {
        private boolean enabled = false;
    }
}
