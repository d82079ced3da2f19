package ai.sturdy.patcher.patch;

import ai.sturdy.patcher.line.LineBuffer;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Applies a {@link HunkSet} to a text buffer. Every hunk is located against the original text and the
 * whole set is validated before any line is changed, so a failure never yields partial output.
 */
public class PatchEngine {

    private static final Logger LOGGER = LoggerFactory.getLogger(PatchEngine.class);
    static final String MDC_HUNK = "hunk";

    private final HunkLocator locator;
    private final OverlapValidator overlapValidator;
    private final PatchApplier applier;

    public PatchEngine() {
        this(new HunkLocator(), new OverlapValidator(), new PatchApplier());
    }

    public PatchEngine(HunkLocator locator, OverlapValidator overlapValidator, PatchApplier applier) {
        this.locator = Objects.requireNonNull(locator, "locator");
        this.overlapValidator = Objects.requireNonNull(overlapValidator, "overlapValidator");
        this.applier = Objects.requireNonNull(applier, "applier");
    }

    public String apply(String originalText, HunkSet patch) {
        return apply(originalText, patch, ProgressListener.none());
    }

    /**
     * @param originalText buffer to patch, left untouched
     * @param patch hunks to apply
     * @param listener receives narration such as {@code Hunk 2: strict match at lines 4-6}
     * @return the patched text
     * @throws PatchException when the patch is malformed, a hunk is ambiguous or missing, or hunks overlap
     */
    public String apply(String originalText, HunkSet patch, ProgressListener listener) {
        Objects.requireNonNull(originalText, "originalText");
        ProgressListener progress = listener == null ? ProgressListener.none() : listener;
        if (patch == null) {
            throw PatchException.malformed("Patch JSON must contain a 'hunks' array.");
        }
        requireComplete(patch);

        LineBuffer buffer = LineBuffer.parse(originalText);
        List<Placement> placements = new ArrayList<>(patch.size());
        for (int index = 0; index < patch.size(); index++) {
            int number = index + 1;
            Hunk hunk = patch.hunks().get(index);
            try (MDC.MDCCloseable ignored = MDC.putCloseable(MDC_HUNK, Integer.toString(number))) {
                narrate(progress, "Hunk " + number + ": " + hunk.describe());
                Placement placement = locator.resolve(number, buffer.lines(), hunk);
                narrate(progress, "Hunk " + number + ": " + placement.mode().label() + " match at lines "
                        + (placement.start() + 1) + "-" + placement.end());
                placements.add(placement);
            }
        }

        overlapValidator.validate(placements);
        String patched = applier.apply(buffer, placements);
        LOGGER.info("Applied {} hunk(s) to {} line(s)", placements.size(), buffer.size());
        return patched;
    }

    private void requireComplete(HunkSet patch) {
        for (int index = 0; index < patch.size(); index++) {
            if (patch.hunks().get(index) == null) {
                throw PatchException.incompleteHunk(index + 1);
            }
        }
    }

    private void narrate(ProgressListener progress, String message) {
        LOGGER.debug(message);
        progress.onProgress(message);
    }
}
