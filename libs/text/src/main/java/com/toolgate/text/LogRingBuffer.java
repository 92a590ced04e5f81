package com.toolgate.text;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.StringJoiner;

/**
 * Keeps the last N lines of a streamed log in a fixed-size circular buffer.
 * <p>
 * Reading starts with a chunked pass that assumes lines fit within {@link #maxLineBytes()}.
 * The first line that does not fit hands the rest of the stream to a byte-wise pass which
 * truncates every oversized line to a short prefix followed by {@value #TRUNCATED_SUFFIX},
 * instead of buffering it. Line terminators are {@code \n}, with a trailing {@code \r} dropped.
 * <p>
 * Instances hold no state between calls; the stream is read to the end but not closed.
 */
public final class LogRingBuffer {

    /** Hard ceiling on retained lines. */
    public static final int MAX_RETAINED_LINES = 100_000;

    /** Default per-line ceiling, 10 MB. */
    public static final int DEFAULT_MAX_LINE_BYTES = 10 * 1024 * 1024;

    /** Appended to the kept prefix of an oversized line. */
    public static final String TRUNCATED_SUFFIX = "... [TRUNCATED]";

    static final int DISPLAY_PREFIX_BYTES = 1000;
    private static final int CHUNK_SIZE = 64 * 1024;

    private final int maxLineBytes;

    public LogRingBuffer() {
        this(DEFAULT_MAX_LINE_BYTES);
    }

    /**
     * @param maxLineBytes longest line kept intact, in bytes
     */
    public LogRingBuffer(int maxLineBytes) {
        if (maxLineBytes <= 0) {
            throw new IllegalArgumentException("maxLineBytes must be positive");
        }
        this.maxLineBytes = maxLineBytes;
    }

    public int maxLineBytes() {
        return maxLineBytes;
    }

    /**
     * Reads {@code in} to the end and returns its last {@code maxLines} lines.
     *
     * @param in       line-oriented UTF-8 stream
     * @param maxLines lines to retain; values above {@value #MAX_RETAINED_LINES} are clamped
     * @throws IllegalArgumentException if {@code maxLines} is not positive
     * @throws UncheckedIOException     if reading fails
     */
    public RingBufferResult process(InputStream in, int maxLines) {
        if (maxLines <= 0) {
            throw new IllegalArgumentException("maxLines must be positive");
        }
        Ring ring = new Ring(Math.min(maxLines, MAX_RETAINED_LINES));
        try {
            boundedPass(in, ring);
        } catch (IOException e) {
            throw new UncheckedIOException("failed to read log content", e);
        }
        return new RingBufferResult(ring.join(), ring.total);
    }

    private void boundedPass(InputStream in, Ring ring) throws IOException {
        byte[] chunk = new byte[CHUNK_SIZE];
        ByteArrayOutputStream line = new ByteArrayOutputStream();
        int n;
        while ((n = in.read(chunk)) != -1) {
            int pos = 0;
            while (pos < n) {
                int newline = indexOf(chunk, pos, n);
                int end = newline < 0 ? n : newline;
                if (line.size() + (end - pos) > maxLineBytes) {
                    byteWisePass(chunk, pos, n, in, line, ring);
                    return;
                }
                line.write(chunk, pos, end - pos);
                if (newline < 0) {
                    pos = n;
                } else {
                    ring.add(decode(line, false));
                    line.reset();
                    pos = newline + 1;
                }
            }
        }
        if (line.size() > 0) {
            ring.add(decode(line, false));
        }
    }

    /**
     * Finishes the stream one byte at a time, starting with {@code chunk[from, to)} and then
     * {@code in}. Bytes past the line ceiling are dropped until the next newline.
     */
    private void byteWisePass(byte[] chunk, int from, int to, InputStream in,
                              ByteArrayOutputStream line, Ring ring) throws IOException {
        LineState state = new LineState(line);
        for (int i = from; i < to; i++) {
            state.accept(chunk[i], ring);
        }
        byte[] buffer = new byte[CHUNK_SIZE];
        int n;
        while ((n = in.read(buffer)) != -1) {
            for (int i = 0; i < n; i++) {
                state.accept(buffer[i], ring);
            }
        }
        state.finish(ring);
    }

    private final class LineState {
        private final ByteArrayOutputStream line;
        private boolean overflowed;

        LineState(ByteArrayOutputStream line) {
            this.line = line;
        }

        void accept(byte b, Ring ring) {
            if (b == '\n') {
                ring.add(decode(line, overflowed));
                line.reset();
                overflowed = false;
            } else if (line.size() < maxLineBytes) {
                line.write(b);
            } else {
                overflowed = true;
            }
        }

        void finish(Ring ring) {
            if (line.size() > 0 || overflowed) {
                ring.add(decode(line, overflowed));
            }
        }
    }

    private String decode(ByteArrayOutputStream line, boolean truncated) {
        byte[] bytes = line.toByteArray();
        if (truncated) {
            int keep = characterBoundary(bytes, Math.min(bytes.length, Math.min(DISPLAY_PREFIX_BYTES, maxLineBytes)));
            return new String(bytes, 0, keep, StandardCharsets.UTF_8) + TRUNCATED_SUFFIX;
        }
        int length = bytes.length;
        if (length > 0 && bytes[length - 1] == '\r') {
            length--;
        }
        return new String(bytes, 0, length, StandardCharsets.UTF_8);
    }

    private static int indexOf(byte[] bytes, int from, int to) {
        for (int i = from; i < to; i++) {
            if (bytes[i] == '\n') {
                return i;
            }
        }
        return -1;
    }

    /** Circular slot array plus validity flags. */
    private static final class Ring {
        private final String[] lines;
        private final boolean[] valid;
        private int writeIndex;
        private int total;

        Ring(int capacity) {
            this.lines = new String[capacity];
            this.valid = new boolean[capacity];
        }

        void add(String line) {
            lines[writeIndex] = line;
            valid[writeIndex] = true;
            writeIndex = (writeIndex + 1) % lines.length;
            total++;
        }

        String join() {
            int retained = Math.min(total, lines.length);
            int start = total > lines.length ? writeIndex : 0;
            StringJoiner out = new StringJoiner("\n");
            for (int i = 0; i < retained; i++) {
                int idx = (start + i) % lines.length;
                if (valid[idx]) {
                    out.add(lines[idx]);
                }
            }
            return out.toString();
        }
    }

    /**
     * Moves {@code limit} back so that {@code bytes[0, limit)} does not end inside a UTF-8 sequence.
     */
    static int characterBoundary(byte[] bytes, int limit) {
        if (limit == 0) {
            return 0;
        }
        int lead = limit - 1;
        while (lead > 0 && (bytes[lead] & 0xC0) == 0x80) {
            lead--;
        }
        int b = bytes[lead] & 0xFF;
        int length;
        if (b < 0x80) {
            length = 1;
        } else if ((b & 0xE0) == 0xC0) {
            length = 2;
        } else if ((b & 0xF0) == 0xE0) {
            length = 3;
        } else if ((b & 0xF8) == 0xF0) {
            length = 4;
        } else {
            // stray continuation byte at the start; nothing to align to
            return limit;
        }
        return lead + length > limit ? lead : limit;
    }
}
