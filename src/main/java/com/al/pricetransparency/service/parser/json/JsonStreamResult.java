package com.al.pricetransparency.service.parser.json;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Builder;
import lombok.Value;

import java.util.Map;

@Value
@Builder
public class JsonStreamResult {

    /**
     * Root object without the streamed arrays. Only available when the file was parsed as one tree.
     */
    JsonNode headerNode;

    /**
     * First bytes of the file, for pattern-based metadata extraction.
     */
    String headerPrefix;

    Map<String, Long> itemCounts;

    long malformedCount;

    boolean streamed;

    int peakBufferSize;

    public long getItemCount(String arrayName) {
        return itemCounts.getOrDefault(arrayName, 0L);
    }
}
