package com.al.pricetransparency.service.parser.json;

import com.al.pricetransparency.model.enums.FileFormat;
import com.al.pricetransparency.model.mrf.ChargeItem;
import com.al.pricetransparency.model.mrf.HospitalMetadata;
import com.al.pricetransparency.model.mrf.ModifierItem;
import com.al.pricetransparency.service.detect.FileMetadata;
import com.al.pricetransparency.service.parser.ChargeFileParser;
import com.al.pricetransparency.service.parser.ChargeItemListener;
import com.al.pricetransparency.service.parser.ParseOptions;
import com.al.pricetransparency.service.parser.ParseResult;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.List;

/**
 * Parser for CMS schema JSON files (v2.x and v3.0).
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class JsonChargeFileParser implements ChargeFileParser {

    static final String CHARGES = "standard_charge_information";
    static final String MODIFIERS = "modifier_information";

    private final StreamingJsonParser streamingParser;
    private final ObjectMapper objectMapper;

    @Override
    public FileFormat format() {
        return FileFormat.JSON;
    }

    @Override
    public ParseResult parse(FileMetadata file, ChargeItemListener listener, ParseOptions options)
            throws IOException {
        HospitalMetadata prefixMetadata = JsonMetadataExtractor.fromPrefix(streamingParser.readPrefix(file.getPath()));
        listener.onMetadata(prefixMetadata);

        ElementAdapter adapter = new ElementAdapter(listener, file);
        JsonStreamResult result = streamingParser.stream(file.getPath(), List.of(CHARGES, MODIFIERS), adapter,
                options.getMaxItems());

        HospitalMetadata metadata = result.getHeaderNode() != null
                ? JsonMetadataExtractor.fromTree(result.getHeaderNode())
                : prefixMetadata;
        if (metadata.getVersion() == null) {
            metadata.setVersion(file.getRawVersion());
        }

        log.info("Parsed {} charge items and {} modifiers from {} ({} failed, streamed={})", adapter.charges,
                adapter.modifiers, file.getPath().getFileName(), result.getMalformedCount() + adapter.failed,
                result.isStreamed());
        return ParseResult.builder()
                .metadata(metadata)
                .format(FileFormat.JSON)
                .chargeCount(adapter.charges)
                .modifierCount(adapter.modifiers)
                .failedCount(result.getMalformedCount() + adapter.failed)
                .build();
    }

    /**
     * Binds raw array elements to the item model and forwards them.
     */
    private final class ElementAdapter implements JsonStreamListener {
        private final ChargeItemListener listener;
        private final FileMetadata file;
        private long charges;
        private long modifiers;
        private long failed;

        ElementAdapter(ChargeItemListener listener, FileMetadata file) {
            this.listener = listener;
            this.file = file;
        }

        @Override
        public void onItem(String arrayName, JsonNode node, long index) {
            if (node == null || !node.isObject()) {
                failed++;
                String reason = "Element is not an object: " + (node == null ? "null" : node.getNodeType());
                log.warn("Skipping element {} of '{}': {}", index, arrayName, reason);
                listener.onParseError(index, reason);
                return;
            }
            try {
                if (CHARGES.equals(arrayName)) {
                    listener.onChargeItem(objectMapper.treeToValue(node, ChargeItem.class), charges++);
                } else {
                    listener.onModifier(objectMapper.treeToValue(node, ModifierItem.class), modifiers++);
                }
            } catch (JsonProcessingException e) {
                failed++;
                log.warn("Skipping element {} of '{}' that does not fit the schema: {}", index, arrayName,
                        e.getOriginalMessage());
                listener.onParseError(index, e.getOriginalMessage());
            } catch (RuntimeException e) {
                failed++;
                log.warn("Skipping element {} of '{}': {}", index, arrayName, e.getMessage());
                listener.onParseError(index, String.valueOf(e.getMessage()));
            }
        }

        @Override
        public void onMalformed(String arrayName, long index, String reason) {
            listener.onParseError(index, reason);
        }

        @Override
        public void onProgress(long count, Long total, long bytesRead) {
            listener.onProgress(count, total != null ? total : file.getEstimatedRecordCount(), bytesRead);
        }
    }
}
