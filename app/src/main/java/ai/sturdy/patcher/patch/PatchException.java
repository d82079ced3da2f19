package ai.sturdy.patcher.patch;

import java.util.Objects;
import java.util.OptionalInt;

/**
 * Runtime exception raised when a patch cannot be applied. No partial result exists when this is thrown.
 */
public class PatchException extends RuntimeException {

    private final PatchFailureKind kind;
    private final Integer hunkNumber;

    public PatchException(PatchFailureKind kind, String message) {
        this(kind, null, message, null);
    }

    public PatchException(PatchFailureKind kind, Integer hunkNumber, String message) {
        this(kind, hunkNumber, message, null);
    }

    public PatchException(PatchFailureKind kind, Integer hunkNumber, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind");
        this.hunkNumber = hunkNumber;
    }

    public PatchFailureKind kind() {
        return kind;
    }

    /**
     * 1-based number of the offending hunk, when the failure concerns a single hunk.
     */
    public OptionalInt hunkNumber() {
        return hunkNumber == null ? OptionalInt.empty() : OptionalInt.of(hunkNumber);
    }

    static PatchException malformed(String message) {
        return new PatchException(PatchFailureKind.MALFORMED_PATCH, message);
    }

    static PatchException incompleteHunk(int hunkNumber) {
        return new PatchException(PatchFailureKind.MALFORMED_PATCH, hunkNumber,
                "Hunk " + hunkNumber + " is missing search_block or replace_block.");
    }

    static PatchException ambiguous(int hunkNumber, MatchMode mode) {
        return new PatchException(PatchFailureKind.AMBIGUOUS_MATCH, hunkNumber,
                "Ambiguous " + mode.label() + " match for hunk " + hunkNumber + ".");
    }

    static PatchException notFound(int hunkNumber) {
        return new PatchException(PatchFailureKind.NOT_FOUND, hunkNumber,
                "Hunk " + hunkNumber + " not found in file.");
    }

    static PatchException overlapping() {
        return new PatchException(PatchFailureKind.OVERLAPPING_HUNKS, "Overlapping hunks detected. Patch aborted.");
    }
}
