package com.al.pricetransparency.service.parser.json;

import com.al.pricetransparency.config.IngestionProperties;
import com.al.pricetransparency.util.FileReaders;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Reader;
import java.nio.channels.Channels;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Delivers the objects of selected top-level arrays of a JSON file one at a time.
 *
 * <p>
 * Files below {@code app.ingestion.streaming-threshold-bytes} are parsed as a single
 * Jackson tree. Larger files are read in chunks through a {@link JsonArrayScanner},
 * which keeps memory bounded independently of the file size; each element is then
 * parsed on its own, so a malformed element is reported and skipped without losing
 * the rest of the file.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class StreamingJsonParser {

    private final IngestionProperties properties;
    private final ObjectMapper objectMapper;

    public String readPrefix(Path file) throws IOException {
        return FileReaders.readPrefix(file, properties.getHeaderPrefixBytes());
    }

    public JsonStreamResult stream(Path file, Collection<String> arrayNames, JsonStreamListener listener,
            Integer maxItems) throws IOException {
        long size = Files.size(file);
        String prefix = readPrefix(file);
        if (size < properties.getStreamingThresholdBytes()) {
            return parseTree(file, size, prefix, arrayNames, listener, maxItems);
        }
        return parseStreaming(file, size, prefix, arrayNames, listener, maxItems);
    }

    private JsonStreamResult parseTree(Path file, long size, String prefix, Collection<String> arrayNames,
            JsonStreamListener listener, Integer maxItems) throws IOException {
        JsonNode root;
        try (Reader reader = FileReaders.openUtf8(file)) {
            root = objectMapper.readTree(reader);
        }
        Map<String, Long> counts = new LinkedHashMap<>();
        long delivered = 0;
        JsonNode header = null;

        if (root != null && root.isObject()) {
            long total = 0;
            for (String arrayName : arrayNames) {
                JsonNode array = root.get(arrayName);
                if (array != null && array.isArray()) {
                    total += array.size();
                }
            }
            for (String arrayName : arrayNames) {
                JsonNode array = root.get(arrayName);
                if (array == null || !array.isArray()) {
                    continue;
                }
                long index = 0;
                for (JsonNode element : array) {
                    if (maxItems != null && delivered >= maxItems) {
                        break;
                    }
                    listener.onItem(arrayName, element, index++);
                    delivered++;
                    reportProgress(listener, delivered, total, size);
                }
                counts.put(arrayName, index);
            }
            ObjectNode copy = ((ObjectNode) root).deepCopy();
            copy.remove(List.copyOf(arrayNames));
            header = copy;
        }
        return JsonStreamResult.builder()
                .headerNode(header)
                .headerPrefix(prefix)
                .itemCounts(counts)
                .malformedCount(0)
                .streamed(false)
                .peakBufferSize(0)
                .build();
    }

    private JsonStreamResult parseStreaming(Path file, long size, String prefix, Collection<String> arrayNames,
            JsonStreamListener listener, Integer maxItems) throws IOException {
        log.info("Streaming {} ({} bytes) in {}-char chunks", file.getFileName(), size,
                properties.getChunkSizeChars());

        StreamSink sink = new StreamSink(listener, maxItems);
        JsonArrayScanner scanner = new JsonArrayScanner(arrayNames, properties.getMaxElementChars(), sink);
        char[] chunk = new char[properties.getChunkSizeChars()];

        try (FileChannel channel = FileChannel.open(file, StandardOpenOption.READ);
                Reader reader = Channels.newReader(channel, StandardCharsets.UTF_8)) {
            int read;
            while (!sink.stopped && (read = reader.read(chunk)) != -1) {
                scanner.feed(chunk, read);
                sink.bytesRead = channel.position();
                if (scanner.isComplete()) {
                    break;
                }
            }
        }

        if (!sink.stopped && scanner.isTruncated()) {
            log.warn("{} ended inside array '{}' at element {}", file.getFileName(), scanner.getCurrentArray(),
                    scanner.getElementIndex());
            sink.malformed++;
            listener.onMalformed(scanner.getCurrentArray(), scanner.getElementIndex(), "Unexpected end of file");
        }

        log.debug("Finished streaming {}: peak buffer {} chars", file.getFileName(), scanner.getPeakBufferSize());
        return JsonStreamResult.builder()
                .headerNode(null)
                .headerPrefix(prefix)
                .itemCounts(sink.counts)
                .malformedCount(sink.malformed)
                .streamed(true)
                .peakBufferSize(scanner.getPeakBufferSize())
                .build();
    }

    private void reportProgress(JsonStreamListener listener, long delivered, Long total, long bytesRead) {
        int interval = properties.getProgressInterval();
        if (interval > 0 && delivered % interval == 0) {
            listener.onProgress(delivered, total, bytesRead);
        }
    }

    /**
     * Parses the elements sliced out by the scanner and forwards them.
     */
    private final class StreamSink implements JsonArrayScanner.ElementSink {
        private final JsonStreamListener listener;
        private final Integer maxItems;
        private final Map<String, Long> counts = new LinkedHashMap<>();
        private long delivered;
        private long malformed;
        private long bytesRead;
        private boolean stopped;

        StreamSink(JsonStreamListener listener, Integer maxItems) {
            this.listener = listener;
            this.maxItems = maxItems;
        }

        @Override
        public void onElement(String arrayName, String json, long index) {
            if (stopped) {
                return;
            }
            counts.merge(arrayName, 1L, Long::sum);
            try {
                JsonNode node = objectMapper.readTree(json);
                listener.onItem(arrayName, node, index);
                delivered++;
                reportProgress(listener, delivered, null, bytesRead);
            } catch (JsonProcessingException e) {
                malformed++;
                log.warn("Skipping malformed element {} of '{}': {}", index, arrayName, e.getOriginalMessage());
                listener.onMalformed(arrayName, index, e.getOriginalMessage());
            }
            if (maxItems != null && delivered >= maxItems) {
                stopped = true;
            }
        }

        @Override
        public void onOversized(String arrayName, long index, long length) {
            if (stopped) {
                return;
            }
            counts.merge(arrayName, 1L, Long::sum);
            malformed++;
            String reason = "Element of " + length + " chars exceeds the limit of "
                    + properties.getMaxElementChars();
            log.warn("Skipping element {} of '{}': {}", index, arrayName, reason);
            listener.onMalformed(arrayName, index, reason);
        }
    }
}
