package com.al.pricetransparency.exception;

/**
 * Thrown when a file is neither a recognizable CMS JSON/CSV file nor a known vendor dialect.
 * Fails the offending file only.
 */
public class UnsupportedFileFormatException extends RuntimeException {

    public UnsupportedFileFormatException(String message) {
        super(message);
    }
}
