package com.al.pricetransparency.service.normalize;

import lombok.Value;

import java.util.List;

@Value
public class ValidationResult {
    boolean valid;
    List<String> errors;

    public static ValidationResult of(List<String> errors) {
        return new ValidationResult(errors.isEmpty(), List.copyOf(errors));
    }
}
