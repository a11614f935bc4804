package com.al.pricetransparency.util;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.BufferedReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class FileReadersTest {

    @TempDir
    Path tempDir;

    @Test
    public void testOpenUtf8_SkipsByteOrderMark() throws Exception {
        Path file = tempDir.resolve("bom.csv");
        Files.write(file, "\uFEFFhospital_name,version".getBytes(StandardCharsets.UTF_8));

        try (BufferedReader reader = FileReaders.openUtf8(file)) {
            assertEquals("hospital_name,version", reader.readLine());
        }
    }

    @Test
    public void testOpenUtf8_WithoutBom() throws Exception {
        Path file = tempDir.resolve("plain.csv");
        Files.writeString(file, "description\n");

        try (BufferedReader reader = FileReaders.openUtf8(file)) {
            assertEquals("description", reader.readLine());
        }
    }

    @Test
    public void testReadPrefix_BoundedAndBomFree() throws Exception {
        Path file = tempDir.resolve("prefix.json");
        Files.write(file, "\uFEFF{\"hospital_name\":\"Acme\"}".getBytes(StandardCharsets.UTF_8));

        String prefix = FileReaders.readPrefix(file, 10);

        assertFalse(prefix.startsWith("\uFEFF"));
        assertTrue(prefix.startsWith("{\"hosp"));
        assertTrue(prefix.length() < 10);
    }

    @Test
    public void testReadPrefix_EmptyFile() throws Exception {
        Path file = tempDir.resolve("empty.json");
        Files.createFile(file);

        assertEquals("", FileReaders.readPrefix(file, 1024));
    }
}
