package com.al.pricetransparency.model.mrf;

import com.al.pricetransparency.model.enums.CodeType;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class CodeInformation {
    private String code;
    private CodeType type;
}
