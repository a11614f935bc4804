package com.al.pricetransparency.service.normalize;

import lombok.Builder;
import lombok.Value;

/**
 * Hospital-level values stamped on every document built from one file.
 */
@Value
@Builder
public class HospitalContext {
    String hospitalId;
    String hospitalName;
    String sourceVersion;
}
