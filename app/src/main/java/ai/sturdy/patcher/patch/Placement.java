package ai.sturdy.patcher.patch;

import ai.sturdy.patcher.line.Line;
import java.util.List;
import java.util.Objects;

/**
 * Resolved line range {@code [start, end)} of one hunk in the original buffer.
 */
public record Placement(int hunkNumber, int start, int end, MatchMode mode, List<Line> replacementLines) {

    public Placement {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Invalid placement range [" + start + ", " + end + ")");
        }
        Objects.requireNonNull(mode, "mode");
        replacementLines = List.copyOf(Objects.requireNonNull(replacementLines, "replacementLines"));
    }

    public boolean overlaps(Placement other) {
        return start < other.end && other.start < end;
    }
}
