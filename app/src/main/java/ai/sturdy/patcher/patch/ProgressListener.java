package ai.sturdy.patcher.patch;

/**
 * Receives human-readable narration of matching decisions. Narration never affects the outcome.
 */
@FunctionalInterface
public interface ProgressListener {

    void onProgress(String message);

    static ProgressListener none() {
        return message -> {
        };
    }
}
