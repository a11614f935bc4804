package com.al.pricetransparency.service.normalize;

import com.al.pricetransparency.model.PayerChargeDocument;
import com.al.pricetransparency.model.StandardChargeDocument;
import com.al.pricetransparency.model.mrf.ChargeItem;
import com.al.pricetransparency.model.mrf.CodeInformation;
import com.al.pricetransparency.model.mrf.PayerCharge;
import com.al.pricetransparency.model.mrf.SettingCharge;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Flattens a {@link ChargeItem} into one {@link StandardChargeDocument} per setting.
 */
@Component
@RequiredArgsConstructor
public class ChargeDocumentBuilder {

    private final PrimaryCodeResolver primaryCodeResolver;

    public List<StandardChargeDocument> toDocuments(ChargeItem item, HospitalContext context, Instant ingestedAt) {
        List<StandardChargeDocument> documents = new ArrayList<>();
        if (item.getSettingCharges() == null) {
            return documents;
        }

        List<CodeInformation> codes = new ArrayList<>();
        if (item.getCodes() != null) {
            item.getCodes().stream().filter(Objects::nonNull).forEach(codes::add);
        }
        CodeInformation primary = primaryCodeResolver.resolve(codes);

        for (SettingCharge charge : item.getSettingCharges()) {
            if (charge == null) {
                continue;
            }
            StandardChargeDocument.StandardChargeDocumentBuilder document = StandardChargeDocument.builder()
                    .hospitalId(context.getHospitalId())
                    .hospitalName(context.getHospitalName())
                    .description(item.getDescription())
                    .codes(new ArrayList<>(codes))
                    .primaryCode(primary != null ? primary.getCode() : null)
                    .primaryCodeType(primary != null ? primary.getType() : null)
                    .setting(charge.getSetting())
                    .grossCharge(charge.getGrossCharge())
                    .discountedCash(charge.getDiscountedCashPrice())
                    .minNegotiated(charge.getMinNegotiated())
                    .maxNegotiated(charge.getMaxNegotiated())
                    .payerCharges(payerDocuments(charge.getPayerCharges()))
                    .modifierCodes(charge.getModifierCodes())
                    .billingClass(charge.getBillingClass())
                    .genericNotes(charge.getNotes())
                    .sourceVersion(context.getSourceVersion())
                    .ingestedAt(ingestedAt);

            if (item.getDrugInfo() != null) {
                document.drugUnit(item.getDrugInfo().getUnit())
                        .drugType(item.getDrugInfo().getType());
            }
            documents.add(document.build());
        }
        return documents;
    }

    private List<PayerChargeDocument> payerDocuments(List<PayerCharge> payers) {
        List<PayerChargeDocument> documents = new ArrayList<>();
        if (payers == null) {
            return documents;
        }
        for (PayerCharge payer : payers) {
            if (payer == null || !payer.hasPriceSignal()) {
                continue;
            }
            documents.add(PayerChargeDocument.builder()
                    .payerName(payer.getPayerName())
                    .planName(payer.getPlanName())
                    .methodology(payer.getMethodology())
                    .dollarAmount(payer.getDollarAmount())
                    .percentage(payer.getPercentage())
                    .algorithm(payer.getAlgorithm())
                    .algorithmicPricing(payer.isAlgorithmicPricing())
                    .medianAmount(payer.getMedianAmount())
                    .percentile10(payer.getPercentile10())
                    .percentile90(payer.getPercentile90())
                    .count(payer.getCount())
                    .estimatedAmount(payer.getEstimatedAmount())
                    .notes(payer.getNotes())
                    .build());
        }
        return documents;
    }
}
