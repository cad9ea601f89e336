package com.ifdefgraph.core.tree;

/**
 * Line/column range of a node in the original source file (1-based, inclusive).
 * {@link #UNKNOWN} is used when the converter did not emit positions.
 */
public record Span(int startLine, int startColumn, int endLine, int endColumn) {

    public static final Span UNKNOWN = new Span(0, 0, 0, 0);

    public boolean isKnown() {
        return startLine > 0;
    }

    /**
     * Parses a pair of srcML position attributes ("12:5"). Returns UNKNOWN if either is missing or malformed.
     */
    public static Span parse(String start, String end) {
        int[] s = parsePosition(start);
        int[] e = parsePosition(end);
        if (s == null) return UNKNOWN;
        if (e == null) e = s;
        return new Span(s[0], s[1], e[0], e[1]);
    }

    private static int[] parsePosition(String pos) {
        if (pos == null || pos.isBlank()) return null;
        int colon = pos.indexOf(':');
        if (colon < 0) return null;
        try {
            return new int[] {
                Integer.parseInt(pos.substring(0, colon).trim()),
                Integer.parseInt(pos.substring(colon + 1).trim())
            };
        } catch (NumberFormatException e) {
            return null;
        }
    }

    @Override
    public String toString() {
        return isKnown() ? startLine + ":" + startColumn : "?";
    }
}
