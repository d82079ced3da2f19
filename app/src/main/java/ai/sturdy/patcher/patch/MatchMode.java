package ai.sturdy.patcher.patch;

import ai.sturdy.patcher.line.Line;

/**
 * Line comparison policies used when locating a hunk.
 */
public enum MatchMode {
    /**
     * Compares tokenized content directly.
     */
    EXACT("strict"),
    /**
     * Compares content after stripping any remaining Unicode whitespace from both ends. The tokenizer
     * only moves spaces and tabs into indent and trailing, so this differs from {@link #EXACT} for
     * characters such as no-break spaces, form feeds or stray carriage returns.
     */
    TOLERANT("floating");

    private final String label;

    MatchMode(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public boolean matches(Line bufferLine, Line searchLine) {
        if (this == EXACT) {
            return bufferLine.content().equals(searchLine.content());
        }
        return stripOuterWhitespace(bufferLine.content()).equals(stripOuterWhitespace(searchLine.content()));
    }

    static String stripOuterWhitespace(String value) {
        int start = 0;
        int end = value.length();
        while (start < end && isWhitespace(value.charAt(start))) {
            start++;
        }
        while (end > start && isWhitespace(value.charAt(end - 1))) {
            end--;
        }
        return value.substring(start, end);
    }

    private static boolean isWhitespace(char ch) {
        return Character.isWhitespace(ch) || Character.isSpaceChar(ch) || ch == '\u0085';
    }
}
