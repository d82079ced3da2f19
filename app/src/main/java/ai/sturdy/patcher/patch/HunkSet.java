package ai.sturdy.patcher.patch;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Ordered hunks of one patch.
 */
public record HunkSet(List<Hunk> hunks) {

    public HunkSet {
        if (hunks == null) {
            throw PatchException.malformed("Patch JSON must contain a 'hunks' array.");
        }
        // Null entries are kept here and reported by the engine with their hunk number.
        hunks = Collections.unmodifiableList(new ArrayList<>(hunks));
    }

    public static HunkSet of(Hunk... hunks) {
        return new HunkSet(List.of(hunks));
    }

    public int size() {
        return hunks.size();
    }
}
