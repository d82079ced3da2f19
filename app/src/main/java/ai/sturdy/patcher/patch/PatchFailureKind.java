package ai.sturdy.patcher.patch;

/**
 * Reasons a patch is rejected as a whole.
 */
public enum PatchFailureKind {
    MALFORMED_PATCH,
    AMBIGUOUS_MATCH,
    NOT_FOUND,
    OVERLAPPING_HUNKS
}
