package com.al.pricetransparency.model;

import com.al.pricetransparency.model.enums.Setting;
import com.al.pricetransparency.model.mrf.ModifierItem;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "hospital_modifiers")
@CompoundIndex(def = "{'hospitalId': 1, 'code': 1}", name = "hospital_modifier_idx", unique = true)
public class ModifierDocument {
    @Id
    private String id;

    private String hospitalId;
    private String code;
    private String description;
    private Setting setting;
    private List<ModifierItem.PayerModification> payerInformation;
    private Instant ingestedAt;
}
