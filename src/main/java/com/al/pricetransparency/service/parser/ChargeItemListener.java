package com.al.pricetransparency.service.parser;

import com.al.pricetransparency.model.mrf.ChargeItem;
import com.al.pricetransparency.model.mrf.HospitalMetadata;
import com.al.pricetransparency.model.mrf.ModifierItem;

/**
 * Receives parser output one item at a time, so no parser ever holds a whole file in memory.
 */
public interface ChargeItemListener {

    void onChargeItem(ChargeItem item, long index);

    default void onModifier(ModifierItem modifier, long index) {
    }

    /**
     * Called before the first item with the best metadata known at that point.
     * The final metadata is returned in {@link ParseResult}.
     */
    default void onMetadata(HospitalMetadata metadata) {
    }

    default void onParseError(long index, String reason) {
    }

    default void onProgress(long processed, Long estimatedTotal, long bytesRead) {
    }
}
