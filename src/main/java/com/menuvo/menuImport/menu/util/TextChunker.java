package com.menuvo.menuImport.menu.util;

import java.util.ArrayList;
import java.util.List;

/**
 * Utility class for splitting long text into line-aligned chunks.
 */
public class TextChunker {

    private TextChunker() {}

    /**
     * Splits text on line boundaries into the fewest contiguous chunks of at most {@code maxSize}
     * characters each. Lines are never split; a single line longer than {@code maxSize} becomes
     * a chunk of its own. Text no longer than {@code maxSize} is returned as one chunk.
     *
     * @param text Text to split
     * @param maxSize Maximum chunk length in characters, must be positive
     * @return Chunks in document order, joined by "\n" they reproduce the input
     */
    public static List<String> split(String text, int maxSize) {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be positive: " + maxSize);
        }
        if (text == null || text.isEmpty()) {
            return List.of();
        }
        if (text.length() <= maxSize) {
            return List.of(text);
        }

        List<String> chunks = new ArrayList<>();
        StringBuilder current = null;
        for (String line : text.split("\n", -1)) {
            if (current == null) {
                current = new StringBuilder(line);
            } else if (current.length() + 1 + line.length() > maxSize) {
                chunks.add(current.toString());
                current = new StringBuilder(line);
            } else {
                current.append('\n').append(line);
            }
        }
        if (current != null) {
            chunks.add(current.toString());
        }
        return chunks;
    }
}
