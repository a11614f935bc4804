package com.al.pricetransparency.util;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * UTF-8 file access shared by the detector and the parsers. Malformed byte
 * sequences are replaced rather than rejected, and a leading byte order mark is skipped.
 */
public final class FileReaders {

    private static final char BOM = '\uFEFF';

    private FileReaders() {
        throw new UnsupportedOperationException("Utility class - do not instantiate");
    }

    public static BufferedReader openUtf8(Path path) throws IOException {
        InputStream in = Files.newInputStream(path);
        BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
        skipBom(reader);
        return reader;
    }

    /**
     * Reads at most {@code maxBytes} from the start of the file, decoded as UTF-8 without a BOM.
     */
    public static String readPrefix(Path path, int maxBytes) throws IOException {
        try (FileChannel channel = FileChannel.open(path, StandardOpenOption.READ)) {
            ByteBuffer buffer = ByteBuffer.allocate((int) Math.min(maxBytes, Math.max(0, channel.size())));
            int read;
            do {
                read = channel.read(buffer);
            } while (read > 0 && buffer.hasRemaining());
            String text = new String(buffer.array(), 0, buffer.position(), StandardCharsets.UTF_8);
            return !text.isEmpty() && text.charAt(0) == BOM ? text.substring(1) : text;
        }
    }

    private static void skipBom(BufferedReader reader) throws IOException {
        reader.mark(1);
        if (reader.read() != BOM) {
            reader.reset();
        }
    }
}
