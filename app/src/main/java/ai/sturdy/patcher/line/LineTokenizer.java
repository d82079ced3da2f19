package ai.sturdy.patcher.line;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Splits raw text into {@link Line} triples.
 */
public final class LineTokenizer {

    private static final Pattern ANY_NEWLINE = Pattern.compile("\r\n|\n");

    private LineTokenizer() {
    }

    /**
     * Tokenizes a single physical line. Leading spaces and tabs become the indent, trailing spaces and
     * tabs become the trailing part. A line made only of spaces and tabs keeps all of them in the indent.
     *
     * @param raw line text without its line terminator
     * @return the tokenized line
     */
    public static Line tokenize(String raw) {
        Objects.requireNonNull(raw, "raw");
        int start = 0;
        int end = raw.length();
        while (start < end && isIndentChar(raw.charAt(start))) {
            start++;
        }
        while (end > start && isIndentChar(raw.charAt(end - 1))) {
            end--;
        }
        return new Line(raw.substring(0, start), raw.substring(start, end), raw.substring(end));
    }

    /**
     * Tokenizes a hunk block. Blocks are split on either line-ending convention, independent of the
     * convention used by the buffer they are applied to.
     */
    public static List<Line> tokenizeBlock(String block) {
        Objects.requireNonNull(block, "block");
        return tokenizeAll(ANY_NEWLINE.split(block, -1));
    }

    static List<Line> tokenizeAll(String[] rawLines) {
        List<Line> lines = new ArrayList<>(rawLines.length);
        for (String raw : rawLines) {
            lines.add(tokenize(raw));
        }
        return lines;
    }

    static boolean isIndentChar(char ch) {
        return ch == ' ' || ch == '\t';
    }
}
