package com.autonomous.ralph.worker;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits a chunked character stream into lines. A line cut across two chunks is held
 * back until its newline arrives. Not thread-safe.
 */
public class StreamLineDecoder {

    private final StringBuilder pending = new StringBuilder();

    /**
     * Appends {@code chunk} and returns every line it completed, without terminators.
     * Blank lines are skipped.
     */
    public List<String> feed(CharSequence chunk) {
        List<String> lines = new ArrayList<>();
        for (int i = 0; i < chunk.length(); i++) {
            char c = chunk.charAt(i);
            if (c == '\n') {
                addLine(lines);
            } else {
                pending.append(c);
            }
        }
        return lines;
    }

    /**
     * Returns whatever is left at end of stream, or an empty list.
     */
    public List<String> flush() {
        List<String> lines = new ArrayList<>(1);
        addLine(lines);
        return lines;
    }

    private void addLine(List<String> lines) {
        int end = pending.length();
        if (end > 0 && pending.charAt(end - 1) == '\r') {
            end--;
        }
        String line = pending.substring(0, end);
        pending.setLength(0);
        if (!line.isBlank()) {
            lines.add(line);
        }
    }
}
