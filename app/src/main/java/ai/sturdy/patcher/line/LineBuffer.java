package ai.sturdy.patcher.line;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Tokenized, mutable view of a text buffer together with its detected line ending.
 * Built once per patch operation and rendered back to text when the operation completes.
 */
public final class LineBuffer {

    private final List<Line> lines;
    private final LineEnding lineEnding;

    private LineBuffer(List<Line> lines, LineEnding lineEnding) {
        this.lines = lines;
        this.lineEnding = lineEnding;
    }

    /**
     * Splits {@code text} on its detected line ending. Empty text yields a single empty line.
     */
    public static LineBuffer parse(String text) {
        Objects.requireNonNull(text, "text");
        LineEnding ending = LineEnding.detect(text);
        if (text.isEmpty()) {
            List<Line> single = new ArrayList<>();
            single.add(LineTokenizer.tokenize(""));
            return new LineBuffer(single, ending);
        }
        String[] rawLines = text.split(Pattern.quote(ending.separator()), -1);
        return new LineBuffer(LineTokenizer.tokenizeAll(rawLines), ending);
    }

    public List<Line> lines() {
        return Collections.unmodifiableList(lines);
    }

    public Line get(int index) {
        return lines.get(index);
    }

    public int size() {
        return lines.size();
    }

    public LineEnding lineEnding() {
        return lineEnding;
    }

    /**
     * Replaces the lines in {@code [start, end)} with {@code replacement} in a single operation.
     */
    public void splice(int start, int end, List<Line> replacement) {
        if (start < 0 || end < start || end > lines.size()) {
            throw new IndexOutOfBoundsException("Invalid splice range [" + start + ", " + end + ") for " + lines.size() + " lines");
        }
        List<Line> range = lines.subList(start, end);
        range.clear();
        range.addAll(replacement);
    }

    public String render() {
        return lines.stream()
                .map(Line::reconstruct)
                .collect(Collectors.joining(lineEnding.separator()));
    }
}
