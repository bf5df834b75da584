package fr.imt.scanzilla.scanzilla.business.model;

/**
 * 0-based, inclusive range of content lines.
 */
public record LineSpan(int startLine, int endLine) {

    public LineSpan {
        if (startLine < 0 || endLine < startLine) {
            throw new IllegalArgumentException("Invalid line span " + startLine + ".." + endLine);
        }
    }

    public int length() {
        return endLine - startLine + 1;
    }
}
