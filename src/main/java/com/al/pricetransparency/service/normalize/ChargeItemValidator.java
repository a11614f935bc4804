package com.al.pricetransparency.service.normalize;

import com.al.pricetransparency.model.mrf.ChargeItem;
import com.al.pricetransparency.model.mrf.CodeInformation;
import com.al.pricetransparency.model.mrf.SettingCharge;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Structural checks on a parsed item. The outcome is advisory; the pipeline decides
 * whether an invalid item is still stored.
 */
@Component
public class ChargeItemValidator {

    public ValidationResult validate(ChargeItem item) {
        List<String> errors = new ArrayList<>();

        if (item.getDescription() == null || item.getDescription().isBlank()) {
            errors.add("Missing description");
        }

        List<CodeInformation> codes = item.getCodes();
        if (codes == null || codes.isEmpty()) {
            errors.add("Missing code information");
        } else {
            for (int i = 0; i < codes.size(); i++) {
                CodeInformation code = codes.get(i);
                if (code == null || code.getCode() == null || code.getCode().isBlank()) {
                    errors.add("Code " + i + " has no value");
                } else if (code.getType() == null) {
                    errors.add("Code " + code.getCode() + " has no recognized type");
                }
            }
        }

        List<SettingCharge> charges = item.getSettingCharges();
        if (charges == null || charges.isEmpty()) {
            errors.add("Missing standard charges");
        } else {
            for (int i = 0; i < charges.size(); i++) {
                SettingCharge charge = charges.get(i);
                if (charge == null) {
                    errors.add("Standard charge " + i + " is empty");
                    continue;
                }
                if (charge.getSetting() == null) {
                    errors.add("Standard charge " + i + " has no setting");
                }
                if (!charge.isMeaningful()) {
                    errors.add("Standard charge " + i + " has no gross charge, cash price or payer rate");
                }
            }
        }

        return ValidationResult.of(errors);
    }
}
