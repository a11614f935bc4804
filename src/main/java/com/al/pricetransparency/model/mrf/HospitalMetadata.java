package com.al.pricetransparency.model.mrf;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Publication-level information of a hospital file, independent of its charge volume.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HospitalMetadata {

    private String hospitalName;

    @Builder.Default
    private List<String> addresses = new ArrayList<>();

    @Builder.Default
    private List<String> locations = new ArrayList<>();

    // v3.0 only
    @Builder.Default
    private List<String> npiNumbers = new ArrayList<>();

    private String licenseNumber;
    private String licenseState;
    private String version;
    private String lastUpdatedOn;

    private String attestationText;
    private boolean attestationConfirmed;
    private String attesterName;

    // v2.x only
    private List<String> financialAidPolicy;

    private String generalContractProvisions;
}
