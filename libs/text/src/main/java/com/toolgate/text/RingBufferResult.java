package com.toolgate.text;

/**
 * Outcome of {@link LogRingBuffer#process}.
 *
 * @param text       retained lines, oldest first, joined with {@code \n}
 * @param totalLines number of lines seen in the stream, including those no longer retained
 */
public record RingBufferResult(String text, int totalLines) {
}
