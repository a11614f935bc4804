package com.al.pricetransparency.service.parser.csv;

import lombok.Value;

import java.util.Arrays;
import java.util.Optional;

/**
 * A data column of a wide CSV file that belongs to one payer/plan.
 *
 * <p>
 * Two header layouts are recognized:
 * <ul>
 * <li>{@code <field>|<payer>|<plan>}, e.g. {@code estimated_amount|Aetna|PPO}</li>
 * <li>{@code standard_charge|<payer>|<plan>|<field>}, e.g.
 * {@code standard_charge|Aetna|PPO|negotiated_dollar}</li>
 * </ul>
 * An empty plan segment yields a column without a plan name, as in tall files.
 */
@Value
public class WidePayerColumn {
    int index;
    String payerName;
    String planName;
    PayerField field;

    public static Optional<WidePayerColumn> classify(int index, String header) {
        if (header == null) {
            return Optional.empty();
        }
        String[] parts = Arrays.stream(header.split("\\|", -1)).map(String::trim).toArray(String[]::new);
        if (parts.length < 3) {
            return Optional.empty();
        }

        PayerField leading = PayerField.fromToken(parts[0]);
        if (leading != null) {
            return build(index, parts[parts.length - 2], parts[parts.length - 1], leading);
        }
        if (parts.length >= 4 && "standard_charge".equals(CsvHeaderIndex.normalize(parts[0]))) {
            PayerField trailing = PayerField.fromToken(parts[parts.length - 1]);
            if (trailing != null) {
                return build(index, parts[1], parts[2], trailing);
            }
        }
        return Optional.empty();
    }

    private static Optional<WidePayerColumn> build(int index, String payer, String plan, PayerField field) {
        if (payer.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new WidePayerColumn(index, payer, plan.isEmpty() ? null : plan, field));
    }

    public String payerKey() {
        return payerName + "|" + (planName != null ? planName : "");
    }
}
