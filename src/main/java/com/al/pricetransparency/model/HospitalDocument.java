package com.al.pricetransparency.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "hospitals")
public class HospitalDocument {
    @Id
    private String id;

    @Indexed(unique = true)
    private String hospitalId;

    private String hospitalName;
    private List<String> addresses;
    private List<String> locations;
    private List<String> npiNumbers;
    private String licenseNumber;
    private String licenseState;

    private String version;
    private String lastUpdatedOn;

    private String attestationText;
    private boolean attestationConfirmed;
    private String attesterName;

    private List<String> financialAidPolicy;
    private String generalContractProvisions;

    // Ingestion bookkeeping
    private String sourceFile;
    private Instant ingestedAt;
    private long chargeCount;
    private long modifierCount;
}
