package org.irlens.render;

import java.util.ArrayList;
import java.util.List;

/**
 * Line-oriented output buffer that knows, at every moment, the line, char index and
 * display column of the next character it will write. Indentation is applied lazily when
 * the first character of a line is written.
 */
final class TextBuffer {

    /**
     * A position in the buffer. Lines are 0-based here; columns are 1-based display columns.
     */
    record Position(int line, int charIndex, int column) {}

    private final int indentSpaces;
    private final List<StringBuilder> lines = new ArrayList<>();
    private final List<Integer> widths = new ArrayList<>();
    private int indentLevel;
    private Position lastWritten;

    TextBuffer(int indentSpaces) {
        this.indentSpaces = indentSpaces;
        lines.add(new StringBuilder());
        widths.add(0);
    }

    void indent() {
        indentLevel++;
    }

    void dedent() {
        if (indentLevel == 0) throw new IllegalStateException("dedent below zero");
        indentLevel--;
    }

    /**
     * Starts a fresh line unless the current one is still empty.
     */
    void startLine() {
        if (current().length() > 0) {
            lines.add(new StringBuilder());
            widths.add(0);
        }
    }

    void write(String text) {
        if (text.isEmpty()) return;
        if (text.indexOf('\n') >= 0) throw new IllegalArgumentException("Line breaks must go through startLine()");
        StringBuilder line = current();
        int last = lines.size() - 1;
        if (line.length() == 0) {
            int pad = indentLevel * indentSpaces;
            line.append(" ".repeat(pad));
            widths.set(last, pad);
        }
        line.append(text);
        widths.set(last, widths.get(last) + DisplayWidth.of(text));
        lastWritten = new Position(last, line.length(), widths.get(last) + 1);
    }

    /**
     * @return Where the next written character will land.
     */
    Position next() {
        int last = lines.size() - 1;
        StringBuilder line = current();
        if (line.length() == 0) {
            int pad = indentLevel * indentSpaces;
            return new Position(last, pad, pad + 1);
        }
        return new Position(last, line.length(), widths.get(last) + 1);
    }

    /**
     * @return The position just after the most recently written character, or {@code null}
     *         if nothing has been written yet.
     */
    Position lastWritten() {
        return lastWritten;
    }

    /**
     * @return The finished lines, without a trailing empty line.
     */
    List<String> lines() {
        List<String> result = new ArrayList<>(lines.size());
        for (StringBuilder line : lines) result.add(line.toString());
        if (result.size() > 1 && result.get(result.size() - 1).isEmpty()) {
            result.remove(result.size() - 1);
        }
        return result;
    }

    private StringBuilder current() {
        return lines.get(lines.size() - 1);
    }
}
