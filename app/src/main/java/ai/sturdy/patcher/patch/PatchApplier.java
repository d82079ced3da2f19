package ai.sturdy.patcher.patch;

import ai.sturdy.patcher.line.Line;
import ai.sturdy.patcher.line.LineBuffer;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Splices validated, non-overlapping placements into a buffer.
 */
public class PatchApplier {

    /**
     * Applies every placement and renders the buffer with its original line ending. Placements are
     * applied from the highest start index down so earlier indices stay valid.
     */
    public String apply(LineBuffer buffer, List<Placement> placements) {
        Objects.requireNonNull(buffer, "buffer");
        List<Placement> ordered = new ArrayList<>(Objects.requireNonNull(placements, "placements"));
        ordered.sort(Comparator.comparingInt(Placement::start).reversed());
        for (Placement placement : ordered) {
            buffer.splice(placement.start(), placement.end(), replacementFor(buffer, placement));
        }
        return buffer.render();
    }

    /**
     * Lines inside the matched range keep their own indent and trailing whitespace and only take the new
     * content. Lines beyond the matched range take the indent of the first matched line.
     */
    List<Line> replacementFor(LineBuffer buffer, Placement placement) {
        int start = placement.start();
        int end = placement.end();
        String inheritedIndent = start < buffer.size() ? buffer.get(start).indent() : "";

        List<Line> replacement = new ArrayList<>(placement.replacementLines().size());
        for (int i = 0; i < placement.replacementLines().size(); i++) {
            Line line = placement.replacementLines().get(i);
            if (start + i < end) {
                replacement.add(buffer.get(start + i).withContent(line.content()));
            } else {
                replacement.add(line.withIndent(inheritedIndent));
            }
        }
        return replacement;
    }
}
