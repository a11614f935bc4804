package com.al.pricetransparency.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@AllArgsConstructor
@NoArgsConstructor
public class PayerSummary {
    private String payerName;
    private int planCount;
}
