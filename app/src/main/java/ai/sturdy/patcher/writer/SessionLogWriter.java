package ai.sturdy.patcher.writer;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Saves a {@link SessionLog} to a timestamped file in the log directory.
 */
public class SessionLogWriter {

    private static final Logger LOGGER = LoggerFactory.getLogger(SessionLogWriter.class);
    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd_HH-mm-ss");
    static final String FILE_PREFIX = "sturdy_patcher_log_";

    private final Clock clock;

    public SessionLogWriter() {
        this(Clock.systemDefaultZone());
    }

    public SessionLogWriter(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * @return the written file, or empty when the log has nothing to save
     */
    public Optional<Path> save(Path logDirectory, SessionLog log) {
        Objects.requireNonNull(logDirectory, "logDirectory");
        Objects.requireNonNull(log, "log");
        if (log.isEmpty()) {
            LOGGER.warn("Debug log is empty.");
            return Optional.empty();
        }
        Path target = logDirectory.resolve(FILE_PREFIX + TIMESTAMP.format(LocalDateTime.now(clock)) + ".txt");
        try {
            Files.createDirectories(logDirectory);
            Files.write(target, log.entries(), StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to save debug log: " + target, ex);
        }
        LOGGER.info("Debug log saved as {}", target);
        return Optional.of(target);
    }
}
