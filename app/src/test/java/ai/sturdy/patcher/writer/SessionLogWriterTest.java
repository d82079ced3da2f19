package ai.sturdy.patcher.writer;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SessionLogWriterTest {

    private final SessionLogWriter writer = new SessionLogWriter(
            Clock.fixed(Instant.parse("2024-03-05T14:07:09Z"), ZoneOffset.UTC));

    @TempDir
    Path tempDir;

    @Test
    void savesEntriesToTimestampedFile() throws IOException {
        SessionLog log = new SessionLog();
        log.onProgress("--- BEGIN PATCH ---");
        log.onProgress("Hunk 1: (no description)");
        log.error("Hunk 1 not found in file.");

        Optional<Path> saved = writer.save(tempDir.resolve("logs"), log);

        assertThat(saved).contains(tempDir.resolve("logs").resolve("sturdy_patcher_log_2024-03-05_14-07-09.txt"));
        assertThat(Files.readAllLines(saved.orElseThrow())).containsExactly(
                "--- BEGIN PATCH ---",
                "Hunk 1: (no description)",
                "ERROR: Hunk 1 not found in file.");
    }

    @Test
    void skipsEmptyLog() {
        SessionLog log = new SessionLog();
        log.onProgress("   ");

        assertThat(writer.save(tempDir, log)).isEmpty();
        assertThat(tempDir.toFile().list()).isEmpty();
    }
}
