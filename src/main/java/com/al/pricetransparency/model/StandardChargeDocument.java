package com.al.pricetransparency.model;

import com.al.pricetransparency.model.enums.BillingClass;
import com.al.pricetransparency.model.enums.CodeType;
import com.al.pricetransparency.model.enums.DrugMeasurementType;
import com.al.pricetransparency.model.enums.Setting;
import com.al.pricetransparency.model.mrf.CodeInformation;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.CompoundIndexes;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * One stored charge: a billable item priced in one setting at one hospital.
 *
 * <p>
 * Re-ingesting a file overwrites documents matched on
 * {@code (hospitalId, description, setting, primaryCode, primaryCodeType)}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "hospital_charges")
@CompoundIndexes({
        @CompoundIndex(def = "{'hospitalId': 1, 'description': 1, 'setting': 1, 'primaryCode': 1, 'primaryCodeType': 1}",
                name = "charge_upsert_key_idx"),
        @CompoundIndex(def = "{'primaryCode': 1, 'primaryCodeType': 1}", name = "primary_code_idx"),
        @CompoundIndex(def = "{'hospitalId': 1, 'setting': 1}", name = "hospital_setting_idx")
})
public class StandardChargeDocument {
    @Id
    private String id;

    @Indexed
    private String hospitalId;
    private String hospitalName;

    private String description;

    @Builder.Default
    private List<CodeInformation> codes = new ArrayList<>();
    private String primaryCode;
    private CodeType primaryCodeType;

    private Setting setting;

    private Double drugUnit;
    private DrugMeasurementType drugType;

    private Double grossCharge;
    private Double discountedCash;
    private Double minNegotiated;
    private Double maxNegotiated;

    @Builder.Default
    private List<PayerChargeDocument> payerCharges = new ArrayList<>();

    private List<String> modifierCodes;
    private BillingClass billingClass;
    private String genericNotes;

    private String sourceVersion;
    private Instant ingestedAt;

    public ChargeDocumentKey key() {
        return new ChargeDocumentKey(hospitalId, description, setting, primaryCode, primaryCodeType);
    }
}
