package io.github.eutro.qdebug.parsing;

import org.jetbrains.annotations.Contract;

import java.util.Arrays;

/**
 * Maps offsets in a transformed text back to offsets in the original program text.
 * <p>
 * The map is a sorted list of segments. A segment starting at transformed offset {@code t}
 * with original offset {@code o} maps every offset {@code x} up to the next segment to
 * {@code o + (x - t)}. Text transformations which preserve length (blanking comments) add
 * nothing, and each removed span starts a new segment at the offset it was removed from.
 */
public final class SourceMap {
    private final int[] transformedStarts;
    private final int[] originalStarts;

    private SourceMap(int[] transformedStarts, int[] originalStarts) {
        this.transformedStarts = transformedStarts;
        this.originalStarts = originalStarts;
    }

    /**
     * Map a transformed offset to the original text.
     * <p>
     * An offset exactly where a span was removed maps to the character after the removed span.
     *
     * @param offset The transformed offset.
     * @return The original offset.
     */
    @Contract(pure = true)
    public int toOriginal(int offset) {
        int idx = Arrays.binarySearch(transformedStarts, offset);
        if (idx < 0) idx = -idx - 2;
        else {
            // several removals at the same offset, take the last
            while (idx + 1 < transformedStarts.length && transformedStarts[idx + 1] == offset) idx++;
        }
        if (idx < 0) idx = 0;
        return originalStarts[idx] + (offset - transformedStarts[idx]);
    }

    /**
     * Builds a {@link SourceMap} by recording removals in order.
     */
    public static final class Builder {
        private int[] transformedStarts = new int[4];
        private int[] originalStarts = new int[4];
        private int size = 1;
        private int removed = 0;

        /**
         * Create a builder for a text which starts at {@code base} in the original.
         *
         * @param base The original offset of the first character.
         */
        public Builder(int base) {
            originalStarts[0] = base;
        }

        /**
         * Record that {@code length} characters were removed, at {@code offset} in the
         * transformed text. Removals must be recorded in increasing offset order.
         *
         * @param offset The transformed offset the text was removed at.
         * @param length The number of characters removed.
         * @return This builder.
         */
        public Builder removed(int offset, int length) {
            if (offset < transformedStarts[size - 1]) {
                throw new IllegalArgumentException("removals out of order");
            }
            removed += length;
            if (size == transformedStarts.length) {
                transformedStarts = Arrays.copyOf(transformedStarts, size * 2);
                originalStarts = Arrays.copyOf(originalStarts, size * 2);
            }
            transformedStarts[size] = offset;
            originalStarts[size] = originalStarts[0] + offset + removed;
            size++;
            return this;
        }

        public SourceMap build() {
            return new SourceMap(Arrays.copyOf(transformedStarts, size), Arrays.copyOf(originalStarts, size));
        }
    }
}
