package com.al.pricetransparency.service.parser.json;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Incremental scanner that slices the objects of selected top-level arrays out of
 * a JSON document fed to it in chunks.
 *
 * <p>
 * The scanner looks for {@code "<key>"} followed by {@code :} and {@code [}, then
 * tracks object depth until each element closes and hands the element text to the
 * {@link ElementSink}. Quotes and escapes are honored, so braces inside string
 * values never change the depth. After an array closes the search resumes for the
 * keys not seen yet, in whatever order they appear.
 *
 * <p>
 * Memory is bounded: after every chunk the buffer is cut down to the unfinished
 * element, or to the few characters that could still begin a key. An element
 * longer than {@code maxElementChars} is dropped while it is being read and
 * reported through {@link ElementSink#onOversized}, so the buffer never holds more
 * than {@code maxElementChars} plus one chunk.
 *
 * <p>
 * Not thread-safe; one instance per file.
 */
public class JsonArrayScanner {

    public enum State {
        SEEKING_KEY,
        SEEKING_ARRAY_START,
        IN_ARRAY,
        IN_OBJECT,
        SKIPPING_OBJECT
    }

    public interface ElementSink {

        void onElement(String arrayName, String json, long index);

        void onOversized(String arrayName, long index, long length);
    }

    private final List<String> remainingKeys;
    private final int maxElementChars;
    private final ElementSink sink;
    private final int keepWhileSeeking;

    private final StringBuilder buffer = new StringBuilder();
    private State state = State.SEEKING_KEY;
    private int pos;
    private boolean colonSeen;

    private String currentArray;
    private long elementIndex;
    private int elementStart = -1;
    private long skippedLength;
    private int depth;
    private boolean inString;
    private boolean escaped;

    private int peakBufferSize;

    public JsonArrayScanner(Collection<String> arrayNames, int maxElementChars, ElementSink sink) {
        if (arrayNames.isEmpty()) {
            throw new IllegalArgumentException("At least one array name is required");
        }
        this.remainingKeys = new ArrayList<>(arrayNames);
        this.maxElementChars = maxElementChars;
        this.sink = sink;
        int longest = 0;
        for (String name : arrayNames) {
            longest = Math.max(longest, quoted(name).length());
        }
        this.keepWhileSeeking = longest - 1;
    }

    public void feed(char[] chunk, int length) {
        buffer.append(chunk, 0, length);
        peakBufferSize = Math.max(peakBufferSize, buffer.length());
        scan();
        trim();
    }

    public void feed(CharSequence chunk) {
        char[] chars = chunk.toString().toCharArray();
        feed(chars, chars.length);
    }

    /**
     * True once every requested array has been closed; the rest of the input can be ignored.
     */
    public boolean isComplete() {
        return remainingKeys.isEmpty() && state == State.SEEKING_KEY;
    }

    /**
     * True when the input ended inside an element or an array.
     */
    public boolean isTruncated() {
        return state == State.IN_OBJECT || state == State.SKIPPING_OBJECT || state == State.IN_ARRAY;
    }

    public State getState() {
        return state;
    }

    public String getCurrentArray() {
        return currentArray;
    }

    public long getElementIndex() {
        return elementIndex;
    }

    public int getBufferSize() {
        return buffer.length();
    }

    public int getPeakBufferSize() {
        return peakBufferSize;
    }

    private void scan() {
        boolean progress = true;
        while (progress) {
            switch (state) {
                case SEEKING_KEY:
                    progress = seekKey();
                    break;
                case SEEKING_ARRAY_START:
                    progress = seekArrayStart();
                    break;
                case IN_ARRAY:
                    progress = scanArray();
                    break;
                case IN_OBJECT:
                case SKIPPING_OBJECT:
                    progress = scanObject();
                    break;
                default:
                    throw new IllegalStateException("Unexpected scanner state " + state);
            }
        }
    }

    private boolean seekKey() {
        if (remainingKeys.isEmpty()) {
            pos = buffer.length();
            return false;
        }
        int best = -1;
        String bestKey = null;
        for (String key : remainingKeys) {
            int found = buffer.indexOf(quoted(key), pos);
            if (found >= 0 && (best < 0 || found < best)) {
                best = found;
                bestKey = key;
            }
        }
        if (best < 0) {
            pos = Math.max(pos, buffer.length() - keepWhileSeeking);
            return false;
        }
        currentArray = bestKey;
        pos = best + quoted(bestKey).length();
        colonSeen = false;
        state = State.SEEKING_ARRAY_START;
        return true;
    }

    private boolean seekArrayStart() {
        while (pos < buffer.length()) {
            char c = buffer.charAt(pos);
            if (Character.isWhitespace(c)) {
                pos++;
            } else if (c == ':' && !colonSeen) {
                colonSeen = true;
                pos++;
            } else if (c == '[' && colonSeen) {
                pos++;
                elementIndex = 0;
                state = State.IN_ARRAY;
                return true;
            } else {
                // The key was a string value, or its value is not an array (null, object)
                if (colonSeen) {
                    remainingKeys.remove(currentArray);
                }
                currentArray = null;
                state = State.SEEKING_KEY;
                return true;
            }
        }
        return false;
    }

    private boolean scanArray() {
        while (pos < buffer.length()) {
            char c = buffer.charAt(pos);
            if (c == '{') {
                elementStart = pos;
                depth = 1;
                inString = false;
                escaped = false;
                pos++;
                state = State.IN_OBJECT;
                return true;
            }
            if (c == ']') {
                pos++;
                remainingKeys.remove(currentArray);
                currentArray = null;
                state = State.SEEKING_KEY;
                return true;
            }
            // whitespace, separators and non-object elements are passed over
            pos++;
        }
        return false;
    }

    private boolean scanObject() {
        while (pos < buffer.length()) {
            char c = buffer.charAt(pos);
            pos++;
            if (inString) {
                if (escaped) {
                    escaped = false;
                } else if (c == '\\') {
                    escaped = true;
                } else if (c == '"') {
                    inString = false;
                }
            } else if (c == '"') {
                inString = true;
            } else if (c == '{' || c == '[') {
                depth++;
            } else if (c == '}' || c == ']') {
                depth--;
                if (depth == 0) {
                    closeElement();
                    return true;
                }
            }

            if (state == State.IN_OBJECT && pos - elementStart > maxElementChars) {
                skippedLength = pos - elementStart;
                elementStart = -1;
                state = State.SKIPPING_OBJECT;
            } else if (state == State.SKIPPING_OBJECT) {
                skippedLength++;
            }
        }
        return false;
    }

    private void closeElement() {
        long index = elementIndex++;
        if (state == State.IN_OBJECT) {
            String json = buffer.substring(elementStart, pos);
            elementStart = -1;
            state = State.IN_ARRAY;
            sink.onElement(currentArray, json, index);
        } else {
            long length = skippedLength + 1;
            skippedLength = 0;
            state = State.IN_ARRAY;
            sink.onOversized(currentArray, index, length);
        }
    }

    private void trim() {
        int cut;
        if (state == State.IN_OBJECT) {
            cut = elementStart;
            elementStart = 0;
        } else {
            cut = pos;
        }
        if (cut > 0) {
            buffer.delete(0, cut);
            pos -= cut;
        }
    }

    private static String quoted(String key) {
        return "\"" + key + "\"";
    }
}
