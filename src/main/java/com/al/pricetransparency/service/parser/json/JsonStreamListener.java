package com.al.pricetransparency.service.parser.json;

import com.fasterxml.jackson.databind.JsonNode;

public interface JsonStreamListener {

    void onItem(String arrayName, JsonNode node, long index);

    default void onMalformed(String arrayName, long index, String reason) {
    }

    default void onProgress(long count, Long total, long bytesRead) {
    }
}
