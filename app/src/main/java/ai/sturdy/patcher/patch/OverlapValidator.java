package ai.sturdy.patcher.patch;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Rejects a set of placements when any two of them share a line.
 */
public class OverlapValidator {

    private static final Logger LOGGER = LoggerFactory.getLogger(OverlapValidator.class);

    public boolean hasOverlap(List<Placement> placements) {
        return firstOverlapIndex(sortedByStart(placements)) >= 0;
    }

    /**
     * @throws PatchException with {@link PatchFailureKind#OVERLAPPING_HUNKS} when two placements intersect
     */
    public void validate(List<Placement> placements) {
        List<Placement> sorted = sortedByStart(placements);
        int index = firstOverlapIndex(sorted);
        if (index >= 0) {
            Placement previous = sorted.get(index - 1);
            Placement current = sorted.get(index);
            LOGGER.debug("Hunk {} [{}, {}) overlaps hunk {} [{}, {})",
                    previous.hunkNumber(), previous.start(), previous.end(),
                    current.hunkNumber(), current.start(), current.end());
            throw PatchException.overlapping();
        }
    }

    // Once sorted by start, an overlap between any two intervals always shows up between neighbours.
    private int firstOverlapIndex(List<Placement> sorted) {
        for (int i = 1; i < sorted.size(); i++) {
            if (sorted.get(i - 1).overlaps(sorted.get(i))) {
                return i;
            }
        }
        return -1;
    }

    private List<Placement> sortedByStart(List<Placement> placements) {
        List<Placement> sorted = new ArrayList<>(Objects.requireNonNull(placements, "placements"));
        sorted.sort(Comparator.comparingInt(Placement::start));
        return sorted;
    }
}
