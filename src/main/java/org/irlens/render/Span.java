package org.irlens.render;

/**
 * A contiguous region of rendered text. Lines and columns are 1-based; columns count
 * display width, not chars or bytes. The end position is exclusive. Offsets index into
 * the rendered string.
 *
 * @param startLine First line of the region.
 * @param startColumn Display column of the first character.
 * @param endLine Last line of the region.
 * @param endColumn Display column just after the last character.
 * @param startOffset Char offset of the first character in the rendered text.
 * @param endOffset Char offset just after the last character.
 */
public record Span(int startLine, int startColumn, int endLine, int endColumn, int startOffset, int endOffset) {

    /**
     * @param text The rendered text this span was produced for.
     * @return The covered text.
     */
    public String extract(String text) {
        return text.substring(startOffset, endOffset);
    }

    public boolean isEmpty() {
        return startOffset == endOffset;
    }

    public boolean isMultiLine() {
        return startLine != endLine;
    }

    @Override
    public String toString() {
        return startLine + ":" + startColumn + "-" + endLine + ":" + endColumn;
    }
}
