package com.al.pricetransparency.runner;

import lombok.Data;

/**
 * Command line of a batch ingestion run.
 */
@Data
public class CliArguments {
    private String file;
    private String dir;
    private Integer batchSize;
    private boolean dryRun;
    private boolean initOnly;
    private boolean stats;
    private boolean help;
    private Integer maxItems;
    private boolean skipExisting;
    private boolean replaceExisting;

    public static CliArguments parse(String[] args) {
        CliArguments result = new CliArguments();
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            switch (arg) {
                case "--file":
                    result.file = value(args, ++i, arg);
                    break;
                case "--dir":
                    result.dir = value(args, ++i, arg);
                    break;
                case "--batch-size":
                    result.batchSize = positiveInt(value(args, ++i, arg), arg);
                    break;
                case "--dry-run":
                    result.dryRun = true;
                    break;
                case "--init-only":
                    result.initOnly = true;
                    break;
                case "--stats":
                    result.stats = true;
                    break;
                case "--max-items":
                    result.maxItems = positiveInt(value(args, ++i, arg), arg);
                    break;
                case "--skip-existing":
                    result.skipExisting = true;
                    break;
                case "--replace-existing":
                    result.replaceExisting = true;
                    break;
                case "--help":
                    result.help = true;
                    break;
                default:
                    // Spring's own options such as --spring.profiles.active
                    break;
            }
        }
        return result;
    }

    private static String value(String[] args, int index, String option) {
        if (index >= args.length) {
            throw new IllegalArgumentException("Missing value for " + option);
        }
        return args[index];
    }

    private static int positiveInt(String raw, String option) {
        try {
            int value = Integer.parseInt(raw);
            if (value <= 0) {
                throw new IllegalArgumentException(option + " must be positive: " + raw);
            }
            return value;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(option + " is not a number: " + raw, e);
        }
    }
}
