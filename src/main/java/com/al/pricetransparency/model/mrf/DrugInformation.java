package com.al.pricetransparency.model.mrf;

import com.al.pricetransparency.model.enums.DrugMeasurementType;
import com.al.pricetransparency.util.LenientDoubleDeserializer;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class DrugInformation {
    @JsonDeserialize(using = LenientDoubleDeserializer.class)
    private Double unit;
    private DrugMeasurementType type;
}
