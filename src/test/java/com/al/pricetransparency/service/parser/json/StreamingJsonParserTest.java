package com.al.pricetransparency.service.parser.json;

import com.al.pricetransparency.config.IngestionProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class StreamingJsonParserTest {

    private static final String CHARGES = "standard_charge_information";

    @TempDir
    Path tempDir;

    private IngestionProperties properties;
    private StreamingJsonParser parser;

    @BeforeEach
    public void setUp() {
        properties = new IngestionProperties();
        properties.setChunkSizeChars(32);
        properties.setMaxElementChars(4096);
        parser = new StreamingJsonParser(properties, new ObjectMapper());
    }

    @Test
    public void testStream_SmallFileParsedAsTree() throws Exception {
        Path file = write(document(3));

        RecordingListener listener = new RecordingListener();
        JsonStreamResult result = parser.stream(file, List.of(CHARGES), listener, null);

        assertFalse(result.isStreamed());
        assertEquals(3, listener.items.size());
        assertEquals(3L, result.getItemCount(CHARGES));
        assertNotNull(result.getHeaderNode());
        assertEquals("Acme General", result.getHeaderNode().get("hospital_name").asText());
        assertFalse(result.getHeaderNode().has(CHARGES));
    }

    @Test
    public void testStream_LargeFileStreamedInChunks() throws Exception {
        properties.setStreamingThresholdBytes(0);
        Path file = write(document(50));

        RecordingListener listener = new RecordingListener();
        JsonStreamResult result = parser.stream(file, List.of(CHARGES), listener, null);

        assertTrue(result.isStreamed());
        assertNull(result.getHeaderNode());
        assertTrue(result.getHeaderPrefix().contains("\"hospital_name\""));
        assertEquals(50, listener.items.size());
        assertEquals("item 49", listener.items.get(49).get("description").asText());
        assertEquals(0, result.getMalformedCount());
        assertTrue(result.getPeakBufferSize() < 200);
    }

    @Test
    public void testStream_TreeAndStreamingDeliverTheSameItems() throws Exception {
        Path file = write(document(20));

        RecordingListener tree = new RecordingListener();
        parser.stream(file, List.of(CHARGES), tree, null);
        properties.setStreamingThresholdBytes(0);
        RecordingListener streamed = new RecordingListener();
        parser.stream(file, List.of(CHARGES), streamed, null);

        assertEquals(tree.items, streamed.items);
    }

    @Test
    public void testStream_MalformedElementIsSkipped() throws Exception {
        properties.setStreamingThresholdBytes(0);
        Path file = write("{\"hospital_name\": \"Acme\", \"standard_charge_information\": ["
                + "{\"description\": \"good one\"}, {\"description\": \"bad\",}, {\"description\": \"good two\"}]}");

        RecordingListener listener = new RecordingListener();
        JsonStreamResult result = parser.stream(file, List.of(CHARGES), listener, null);

        assertEquals(2, listener.items.size());
        assertEquals(1, result.getMalformedCount());
        assertEquals(List.of(1L), listener.malformedIndexes);
        assertEquals(3L, result.getItemCount(CHARGES));
    }

    @Test
    public void testStream_MaxItemsStopsEarly() throws Exception {
        properties.setStreamingThresholdBytes(0);
        Path file = write(document(100));

        RecordingListener listener = new RecordingListener();
        parser.stream(file, List.of(CHARGES), listener, 5);

        assertEquals(5, listener.items.size());
    }

    @Test
    public void testStream_MaxItemsOnTreePath() throws Exception {
        Path file = write(document(10));

        RecordingListener listener = new RecordingListener();
        parser.stream(file, List.of(CHARGES), listener, 4);

        assertEquals(4, listener.items.size());
    }

    @Test
    public void testStream_TruncatedFileReportsMalformedTail() throws Exception {
        properties.setStreamingThresholdBytes(0);
        Path file = write("{\"hospital_name\": \"Acme\", \"standard_charge_information\": ["
                + "{\"description\": \"complete\"}, {\"description\": \"cut off");

        RecordingListener listener = new RecordingListener();
        JsonStreamResult result = parser.stream(file, List.of(CHARGES), listener, null);

        assertEquals(1, listener.items.size());
        assertEquals(1, result.getMalformedCount());
        assertEquals(List.of("Unexpected end of file"), listener.malformedReasons);
    }

    @Test
    public void testStream_OversizedElementIsReported() throws Exception {
        properties.setStreamingThresholdBytes(0);
        properties.setMaxElementChars(64);
        Path file = write("{\"standard_charge_information\": [{\"description\": \"" + "y".repeat(500) + "\"}, "
                + "{\"description\": \"ok\"}]}");

        RecordingListener listener = new RecordingListener();
        JsonStreamResult result = parser.stream(file, List.of(CHARGES), listener, null);

        assertEquals(1, listener.items.size());
        assertEquals("ok", listener.items.get(0).get("description").asText());
        assertEquals(1, result.getMalformedCount());
        assertTrue(listener.malformedReasons.get(0).contains("exceeds the limit of 64"));
    }

    @Test
    public void testReadPrefix_UsesConfiguredSize() throws Exception {
        properties.setHeaderPrefixBytes(16);
        Path file = write(document(5));

        assertEquals(16, parser.readPrefix(file).length());
    }

    private Path write(String content) throws Exception {
        Path file = tempDir.resolve("charges.json");
        Files.writeString(file, content);
        return file;
    }

    private static String document(int items) {
        StringBuilder json = new StringBuilder(
                "{\"hospital_name\": \"Acme General\", \"version\": \"3.0.0\", \"standard_charge_information\": [");
        for (int i = 0; i < items; i++) {
            if (i > 0) {
                json.append(", ");
            }
            json.append("{\"description\": \"item ").append(i).append("\", \"standard_charges\": [{\"setting\": ")
                    .append("\"outpatient\", \"gross_charge\": ").append(100 + i).append("}]}");
        }
        return json.append("]}").toString();
    }

    private static final class RecordingListener implements JsonStreamListener {
        private final List<JsonNode> items = new ArrayList<>();
        private final List<Long> malformedIndexes = new ArrayList<>();
        private final List<String> malformedReasons = new ArrayList<>();

        @Override
        public void onItem(String arrayName, JsonNode node, long index) {
            items.add(node);
        }

        @Override
        public void onMalformed(String arrayName, long index, String reason) {
            malformedIndexes.add(index);
            malformedReasons.add(reason);
        }
    }
}
