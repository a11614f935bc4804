package com.al.pricetransparency.service.parser;

import com.al.pricetransparency.model.mrf.ChargeItem;
import com.al.pricetransparency.model.mrf.HospitalMetadata;
import com.al.pricetransparency.model.mrf.ModifierItem;

import java.util.ArrayList;
import java.util.List;

/**
 * Collects everything a parser reports, for assertions.
 */
public class RecordingChargeListener implements ChargeItemListener {

    public final List<ChargeItem> items = new ArrayList<>();
    public final List<Long> indexes = new ArrayList<>();
    public final List<ModifierItem> modifiers = new ArrayList<>();
    public final List<String> errors = new ArrayList<>();
    public HospitalMetadata metadata;
    public int progressReports;
    public Long lastProgressTotal;
    public long lastBytesRead;

    @Override
    public void onChargeItem(ChargeItem item, long index) {
        items.add(item);
        indexes.add(index);
    }

    @Override
    public void onModifier(ModifierItem modifier, long index) {
        modifiers.add(modifier);
    }

    @Override
    public void onMetadata(HospitalMetadata metadata) {
        this.metadata = metadata;
    }

    @Override
    public void onParseError(long index, String reason) {
        errors.add(reason);
    }

    @Override
    public void onProgress(long processed, Long estimatedTotal, long bytesRead) {
        progressReports++;
        lastProgressTotal = estimatedTotal;
        lastBytesRead = bytesRead;
    }
}
