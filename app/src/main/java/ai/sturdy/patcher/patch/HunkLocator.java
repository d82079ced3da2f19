package ai.sturdy.patcher.patch;

import ai.sturdy.patcher.line.Line;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Finds where a tokenized search block occurs in a tokenized buffer.
 */
public class HunkLocator {

    /**
     * Scans every window of {@code searchLines.size()} consecutive buffer lines.
     *
     * @param bufferLines lines of the original buffer
     * @param searchLines lines that must match contiguously
     * @param mode line comparison policy
     * @return ascending 0-based start indices of all matching windows, empty when the search block is
     *         empty or longer than the buffer
     */
    public List<Integer> locate(List<Line> bufferLines, List<Line> searchLines, MatchMode mode) {
        Objects.requireNonNull(bufferLines, "bufferLines");
        Objects.requireNonNull(searchLines, "searchLines");
        Objects.requireNonNull(mode, "mode");
        List<Integer> matches = new ArrayList<>();
        if (searchLines.isEmpty()) {
            return matches;
        }
        int window = searchLines.size();
        int maxStart = bufferLines.size() - window;
        for (int start = 0; start <= maxStart; start++) {
            if (matchesAt(bufferLines, searchLines, start, mode)) {
                matches.add(start);
            }
        }
        return matches;
    }

    /**
     * Resolves a unique placement for {@code hunk}: exact matching first, tolerant matching only when no
     * exact match exists. More than one match in the attempted mode is never narrowed down.
     *
     * @throws PatchException with {@link PatchFailureKind#AMBIGUOUS_MATCH} or {@link PatchFailureKind#NOT_FOUND}
     */
    public Placement resolve(int hunkNumber, List<Line> bufferLines, Hunk hunk) {
        List<Line> searchLines = hunk.searchLines();
        List<Line> replaceLines = hunk.replaceLines();

        List<Integer> exact = locate(bufferLines, searchLines, MatchMode.EXACT);
        if (exact.size() > 1) {
            throw PatchException.ambiguous(hunkNumber, MatchMode.EXACT);
        }
        if (exact.size() == 1) {
            return placementAt(hunkNumber, exact.get(0), searchLines, MatchMode.EXACT, replaceLines);
        }

        List<Integer> tolerant = locate(bufferLines, searchLines, MatchMode.TOLERANT);
        if (tolerant.size() > 1) {
            throw PatchException.ambiguous(hunkNumber, MatchMode.TOLERANT);
        }
        if (tolerant.isEmpty()) {
            throw PatchException.notFound(hunkNumber);
        }
        return placementAt(hunkNumber, tolerant.get(0), searchLines, MatchMode.TOLERANT, replaceLines);
    }

    private boolean matchesAt(List<Line> bufferLines, List<Line> searchLines, int start, MatchMode mode) {
        for (int offset = 0; offset < searchLines.size(); offset++) {
            if (!mode.matches(bufferLines.get(start + offset), searchLines.get(offset))) {
                return false;
            }
        }
        return true;
    }

    private Placement placementAt(int hunkNumber, int start, List<Line> searchLines, MatchMode mode, List<Line> replaceLines) {
        return new Placement(hunkNumber, start, start + searchLines.size(), mode, replaceLines);
    }
}
