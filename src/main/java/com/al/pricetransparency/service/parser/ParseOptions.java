package com.al.pricetransparency.service.parser;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ParseOptions {

    /**
     * Upper bound on items delivered to the listener; null means unbounded.
     */
    Integer maxItems;

    @Builder.Default
    int progressInterval = 1000;

    public static ParseOptions defaults() {
        return ParseOptions.builder().build();
    }

    public boolean isProgressDue(long delivered) {
        return progressInterval > 0 && delivered % progressInterval == 0;
    }

    public boolean limitReached(long delivered) {
        return maxItems != null && delivered >= maxItems;
    }
}
