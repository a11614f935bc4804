package com.al.pricetransparency.service.parser.json;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class JsonArrayScannerTest {

    private static final String DOCUMENT = "{\"hospital_name\": \"Acme\", \"version\": \"3.0.0\", "
            + "\"standard_charge_information\": ["
            + "{\"description\": \"MRI {brain}\", \"code_information\": [{\"code\": \"70551\", \"type\": \"CPT\"}]}, "
            + "{\"description\": \"Quote \\\" and ] inside\"}, "
            + "{\"description\": \"CT\"}"
            + "], \"modifier_information\": [{\"code\": \"50\"}]}";

    @Test
    public void testFeed_WholeDocument() {
        RecordingSink sink = new RecordingSink();
        JsonArrayScanner scanner = new JsonArrayScanner(List.of("standard_charge_information"), 10_000, sink);

        scanner.feed(DOCUMENT);

        assertEquals(3, sink.elements.size());
        assertTrue(sink.elements.get(0).startsWith("{\"description\": \"MRI {brain}\""));
        assertTrue(sink.elements.get(0).endsWith("]}"));
        assertEquals("{\"description\": \"CT\"}", sink.elements.get(2));
        assertEquals(List.of(0L, 1L, 2L), sink.indexes);
        assertTrue(scanner.isComplete());
        assertFalse(scanner.isTruncated());
    }

    @Test
    public void testFeed_ChunkBoundariesDoNotMatter() {
        RecordingSink whole = new RecordingSink();
        new JsonArrayScanner(List.of("standard_charge_information", "modifier_information"), 10_000, whole)
                .feed(DOCUMENT);

        for (int chunkSize = 1; chunkSize <= 17; chunkSize++) {
            RecordingSink chunked = new RecordingSink();
            JsonArrayScanner scanner = new JsonArrayScanner(
                    List.of("standard_charge_information", "modifier_information"), 10_000, chunked);
            for (int i = 0; i < DOCUMENT.length(); i += chunkSize) {
                scanner.feed(DOCUMENT.substring(i, Math.min(DOCUMENT.length(), i + chunkSize)));
            }
            assertEquals(whole.elements, chunked.elements, "chunk size " + chunkSize);
            assertEquals(whole.arrays, chunked.arrays, "chunk size " + chunkSize);
            assertTrue(scanner.isComplete());
        }
    }

    @Test
    public void testFeed_SeveralArraysInFileOrder() {
        RecordingSink sink = new RecordingSink();
        JsonArrayScanner scanner = new JsonArrayScanner(
                List.of("modifier_information", "standard_charge_information"), 10_000, sink);

        scanner.feed(DOCUMENT);

        assertEquals(4, sink.elements.size());
        assertEquals("standard_charge_information", sink.arrays.get(0));
        assertEquals("modifier_information", sink.arrays.get(3));
        assertEquals("{\"code\": \"50\"}", sink.elements.get(3));
    }

    @Test
    public void testFeed_OversizedElementIsSkipped() {
        String big = "x".repeat(200);
        String json = "{\"standard_charge_information\": [{\"description\": \"" + big + "\"}, "
                + "{\"description\": \"small\"}]}";
        RecordingSink sink = new RecordingSink();
        JsonArrayScanner scanner = new JsonArrayScanner(List.of("standard_charge_information"), 100, sink);

        for (int i = 0; i < json.length(); i += 16) {
            scanner.feed(json.substring(i, Math.min(json.length(), i + 16)));
        }

        assertEquals(List.of("{\"description\": \"small\"}"), sink.elements);
        assertEquals(List.of(1L), sink.indexes);
        assertEquals(1, sink.oversized.size());
        assertEquals(0L, sink.oversized.get(0));
        assertTrue(sink.oversizedLengths.get(0) > 100);
        assertTrue(scanner.getPeakBufferSize() <= 100 + 16);
        assertTrue(scanner.isComplete());
    }

    @Test
    public void testFeed_BufferStaysBoundedBetweenElements() {
        StringBuilder json = new StringBuilder("{\"standard_charge_information\": [");
        for (int i = 0; i < 1000; i++) {
            if (i > 0) {
                json.append(',');
            }
            json.append("{\"description\": \"item ").append(i).append("\"}");
        }
        json.append("]}");

        RecordingSink sink = new RecordingSink();
        JsonArrayScanner scanner = new JsonArrayScanner(List.of("standard_charge_information"), 1_000, sink);
        for (int i = 0; i < json.length(); i += 64) {
            scanner.feed(json.substring(i, Math.min(json.length(), i + 64)));
            assertTrue(scanner.getBufferSize() < 64 + 40);
        }

        assertEquals(1000, sink.elements.size());
        assertTrue(scanner.getPeakBufferSize() < 64 + 40);
    }

    @Test
    public void testFeed_TruncatedInput() {
        RecordingSink sink = new RecordingSink();
        JsonArrayScanner scanner = new JsonArrayScanner(List.of("standard_charge_information"), 10_000, sink);

        scanner.feed("{\"standard_charge_information\": [{\"description\": \"MRI\"}, {\"description\": \"C");

        assertEquals(1, sink.elements.size());
        assertTrue(scanner.isTruncated());
        assertFalse(scanner.isComplete());
        assertEquals(JsonArrayScanner.State.IN_OBJECT, scanner.getState());
        assertEquals("standard_charge_information", scanner.getCurrentArray());
        assertEquals(1L, scanner.getElementIndex());
    }

    @Test
    public void testFeed_KeyAsStringValueIsIgnored() {
        RecordingSink sink = new RecordingSink();
        JsonArrayScanner scanner = new JsonArrayScanner(List.of("standard_charge_information"), 10_000, sink);

        scanner.feed("{\"note\": \"standard_charge_information\", "
                + "\"standard_charge_information\": [{\"description\": \"MRI\"}]}");

        assertEquals(List.of("{\"description\": \"MRI\"}"), sink.elements);
    }

    @Test
    public void testFeed_MissingArray() {
        RecordingSink sink = new RecordingSink();
        JsonArrayScanner scanner = new JsonArrayScanner(List.of("standard_charge_information"), 10_000, sink);

        scanner.feed("{\"hospital_name\": \"Acme\"}");

        assertTrue(sink.elements.isEmpty());
        assertFalse(scanner.isComplete());
        assertFalse(scanner.isTruncated());
    }

    @Test
    public void testConstructor_RequiresArrayName() {
        assertThrows(IllegalArgumentException.class,
                () -> new JsonArrayScanner(List.of(), 100, new RecordingSink()));
    }

    private static final class RecordingSink implements JsonArrayScanner.ElementSink {
        private final List<String> elements = new ArrayList<>();
        private final List<String> arrays = new ArrayList<>();
        private final List<Long> indexes = new ArrayList<>();
        private final List<Long> oversized = new ArrayList<>();
        private final List<Long> oversizedLengths = new ArrayList<>();

        @Override
        public void onElement(String arrayName, String json, long index) {
            elements.add(json);
            arrays.add(arrayName);
            indexes.add(index);
        }

        @Override
        public void onOversized(String arrayName, long index, long length) {
            oversized.add(index);
            oversizedLengths.add(length);
        }
    }
}
