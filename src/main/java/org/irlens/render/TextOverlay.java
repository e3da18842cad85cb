package org.irlens.render;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Inserts annotation comment lines and caret underline lines into printed base text, then
 * maps base-text positions to the final text.
 * <p>
 * Annotations go on their own line directly above the line a statement starts on, indented
 * like it. Underlines go on their own line directly below each covered line. Base lines are
 * never edited, so every recorded span stays valid after a line shift.
 */
final class TextOverlay {

    private final List<String> base;
    private final Map<Integer, List<String>> annotations = new TreeMap<>();
    private final Map<Integer, List<int[]>> carets = new TreeMap<>();

    TextOverlay(List<String> base) {
        this.base = base;
    }

    void annotate(PrintedSpan span, String label) {
        int line = clamp(span.start()).line();
        List<String> comments = annotations.computeIfAbsent(line, l -> new ArrayList<>());
        String indent = " ".repeat(leadingSpaces(base.get(line)));
        for (String part : label.split("\n", -1)) {
            comments.add(indent + "# " + part);
        }
    }

    void underline(PrintedSpan span) {
        TextBuffer.Position start = clamp(span.start());
        TextBuffer.Position end = clamp(span.end());
        boolean empty = start.line() == end.line() && start.charIndex() == end.charIndex();
        for (int line = start.line(); line <= end.line(); line++) {
            String text = base.get(line);
            int from = line == start.line() ? start.column() : leadingSpaces(text) + 1;
            int to = line == end.line() ? end.column() : DisplayWidth.of(text) + 1;
            if (to <= from) {
                if (!empty) continue;
                to = from + 1;
            }
            carets.computeIfAbsent(line, l -> new ArrayList<>()).add(new int[] {from, to});
        }
    }

    Layout apply() {
        List<String> lines = new ArrayList<>();
        int[] lineMap = new int[base.size()];
        for (int i = 0; i < base.size(); i++) {
            lines.addAll(annotations.getOrDefault(i, List.of()));
            lineMap[i] = lines.size();
            lines.add(base.get(i));
            List<int[]> ranges = carets.get(i);
            if (ranges != null) lines.add(caretLine(ranges));
        }
        int[] offsets = new int[lines.size()];
        StringBuilder text = new StringBuilder();
        for (int i = 0; i < lines.size(); i++) {
            offsets[i] = text.length();
            text.append(lines.get(i)).append('\n');
        }
        return new Layout(text.toString(), lineMap, offsets);
    }

    /**
     * Pulls a position recorded past the end of its line, or on a dropped trailing line,
     * back onto text that exists.
     */
    TextBuffer.Position clamp(TextBuffer.Position position) {
        int line = position.line();
        if (line >= base.size()) {
            int last = base.size() - 1;
            return new TextBuffer.Position(last, base.get(last).length(), DisplayWidth.of(base.get(last)) + 1);
        }
        String text = base.get(line);
        if (position.charIndex() > text.length()) {
            return new TextBuffer.Position(line, text.length(), DisplayWidth.of(text) + 1);
        }
        return position;
    }

    private static String caretLine(List<int[]> ranges) {
        int width = 0;
        for (int[] range : ranges) width = Math.max(width, range[1] - 1);
        char[] chars = new char[width];
        Arrays.fill(chars, ' ');
        for (int[] range : ranges) {
            for (int column = range[0]; column < range[1]; column++) chars[column - 1] = '^';
        }
        return new String(chars).stripTrailing();
    }

    private static int leadingSpaces(String text) {
        int count = 0;
        while (count < text.length() && text.charAt(count) == ' ') count++;
        return count;
    }

    /**
     * The final text and the mapping from base lines into it.
     */
    final class Layout {
        private final String text;
        private final int[] lineMap;
        private final int[] offsets;

        private Layout(String text, int[] lineMap, int[] offsets) {
            this.text = text;
            this.lineMap = lineMap;
            this.offsets = offsets;
        }

        String text() {
            return text;
        }

        Span toSpan(PrintedSpan printed) {
            TextBuffer.Position start = clamp(printed.start());
            TextBuffer.Position end = clamp(printed.end());
            int startLine = lineMap[start.line()];
            int endLine = lineMap[end.line()];
            return new Span(startLine + 1, start.column(), endLine + 1, end.column(),
                    offsets[startLine] + start.charIndex(), offsets[endLine] + end.charIndex());
        }
    }
}
