package ai.sturdy.patcher.line;

import java.util.Objects;

/**
 * One physical line split into its leading indentation, core content and trailing whitespace.
 * Concatenating the three parts always reproduces the source line.
 */
public record Line(String indent, String content, String trailing) {

    public Line {
        Objects.requireNonNull(indent, "indent");
        Objects.requireNonNull(content, "content");
        Objects.requireNonNull(trailing, "trailing");
    }

    public String reconstruct() {
        return indent + content + trailing;
    }

    public Line withContent(String newContent) {
        return new Line(indent, newContent, trailing);
    }

    public Line withIndent(String newIndent) {
        return new Line(newIndent, content, trailing);
    }
}
