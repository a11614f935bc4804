package com.al.pricetransparency.util;

import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Derives a stable hospital identifier from a price file name,
 * e.g. {@code Acme_General_standardcharges.json -> acme-general}.
 */
public final class HospitalIdGenerator {

    // Applied in order, so "x_mrf_charges" loses both suffixes
    private static final List<Pattern> SUFFIXES = List.of(
            Pattern.compile("_standardcharges$", Pattern.CASE_INSENSITIVE),
            Pattern.compile("_standard_charges$", Pattern.CASE_INSENSITIVE),
            Pattern.compile("_charges$", Pattern.CASE_INSENSITIVE),
            Pattern.compile("_mrf$", Pattern.CASE_INSENSITIVE));
    private static final Pattern NON_ALPHANUMERIC = Pattern.compile("[^a-z0-9]+");
    private static final Pattern EDGE_DASHES = Pattern.compile("^-|-$");

    private HospitalIdGenerator() {
        throw new UnsupportedOperationException("Utility class - do not instantiate");
    }

    public static String fromPath(Path path) {
        return fromFileName(path.getFileName().toString());
    }

    public static String fromFileName(String fileName) {
        String name = fileName;
        int dot = name.lastIndexOf('.');
        if (dot > 0) {
            name = name.substring(0, dot);
        }
        for (Pattern suffix : SUFFIXES) {
            name = suffix.matcher(name).replaceFirst("");
        }
        name = NON_ALPHANUMERIC.matcher(name.toLowerCase(Locale.ROOT)).replaceAll("-");
        return EDGE_DASHES.matcher(name).replaceAll("");
    }
}
