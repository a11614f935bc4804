package com.al.pricetransparency.model;

import com.al.pricetransparency.model.enums.CodeType;
import com.al.pricetransparency.model.enums.Setting;
import lombok.Value;

/**
 * Identity of a stored charge used for upserts.
 */
@Value
public class ChargeDocumentKey {
    String hospitalId;
    String description;
    Setting setting;
    String primaryCode;
    CodeType primaryCodeType;
}
