package ai.sturdy.patcher.writer;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Writes patched text to disk exactly as produced by the engine.
 */
public class PatchedFileWriter {

    public Path write(Path target, String text) {
        if (target == null || text == null) {
            throw new IllegalArgumentException("target and text must be provided");
        }
        try {
            Path parent = target.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(target, text, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE);
            return target;
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to write patched file: " + target, ex);
        }
    }
}
