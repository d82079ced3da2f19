package ai.sturdy.patcher.line;

/**
 * Line terminator convention of a buffer.
 */
public enum LineEnding {
    CRLF("\r\n"),
    LF("\n");

    private final String separator;

    LineEnding(String separator) {
        this.separator = separator;
    }

    public String separator() {
        return separator;
    }

    /**
     * A single CRLF anywhere in the text makes CRLF the convention for the whole buffer.
     */
    public static LineEnding detect(String text) {
        if (text != null && text.contains(CRLF.separator)) {
            return CRLF;
        }
        return LF;
    }
}
