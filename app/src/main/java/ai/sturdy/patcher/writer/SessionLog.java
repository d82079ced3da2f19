package ai.sturdy.patcher.writer;

import ai.sturdy.patcher.patch.ProgressListener;
import java.util.ArrayList;
import java.util.List;

/**
 * In-memory narration of one patch session.
 */
public class SessionLog implements ProgressListener {

    private final List<String> entries = new ArrayList<>();

    @Override
    public void onProgress(String message) {
        entries.add(message == null ? "" : message);
    }

    public void error(String message) {
        onProgress("ERROR: " + message);
    }

    public List<String> entries() {
        return List.copyOf(entries);
    }

    public boolean isEmpty() {
        return entries.stream().allMatch(String::isBlank);
    }
}
