package com.al.pricetransparency.exception;

/**
 * The upstream pricing service answered with a non-success status or could not be reached.
 */
public class PricingApiException extends RuntimeException {

    private final Integer statusCode;

    public PricingApiException(String message, Integer statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public PricingApiException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = null;
    }

    public Integer getStatusCode() {
        return statusCode;
    }
}
