package ai.sturdy.patcher.writer;

import ai.sturdy.patcher.config.Config;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Chooses where a patched buffer is written. Outputs sit next to their source file with a
 * {@code _v<major>.<minor>} suffix so earlier versions are never overwritten.
 */
public class VersionedOutputResolver {

    private static final Logger LOGGER = LoggerFactory.getLogger(VersionedOutputResolver.class);
    static final String INITIAL_SUFFIX = "_v0.0";
    private static final int MINOR_ROLLOVER = 10;

    public Path resolve(Optional<Path> sourceFile, Config config) {
        Objects.requireNonNull(config, "config");
        if (sourceFile == null || sourceFile.isEmpty()) {
            return config.outputDirectory().resolve(config.defaultOutputName());
        }
        Path source = sourceFile.get();
        Path directory = parentOf(source);
        FileName name = FileName.of(source);
        if (!config.versioningEnabled()) {
            return directory.resolve(name.base() + name.extension());
        }
        String suffix = config.versionSuffix()
                .map(VersionedOutputResolver::normalizeSuffix)
                .orElseGet(() -> nextVersionSuffix(directory, name.base()));
        return directory.resolve(name.base() + suffix + name.extension());
    }

    /**
     * Finds the highest {@code base_vX.Y} sibling and returns the suffix after it. Minor versions roll
     * over into the next major at ten.
     */
    public String nextVersionSuffix(Path directory, String base) {
        Pattern pattern = Pattern.compile(Pattern.quote(base) + "_v(\\d+)\\.(\\d+)");
        int maxMajor = -1;
        int maxMinor = -1;
        try (Stream<Path> entries = Files.list(directory)) {
            for (Path entry : (Iterable<Path>) entries::iterator) {
                String stem = FileName.of(entry).base();
                Matcher matcher = pattern.matcher(stem);
                if (!matcher.lookingAt()) {
                    continue;
                }
                int major = Integer.parseInt(matcher.group(1));
                int minor = Integer.parseInt(matcher.group(2));
                if (major > maxMajor || (major == maxMajor && minor > maxMinor)) {
                    maxMajor = major;
                    maxMinor = minor;
                }
            }
        } catch (IOException | NumberFormatException ex) {
            LOGGER.warn("Could not scan {} for existing versions: {}", directory, ex.getMessage());
            return INITIAL_SUFFIX;
        }
        if (maxMajor < 0) {
            return INITIAL_SUFFIX;
        }
        int major = maxMajor;
        int minor = maxMinor + 1;
        if (minor >= MINOR_ROLLOVER) {
            major++;
            minor = 0;
        }
        return "_v" + major + "." + minor;
    }

    static String normalizeSuffix(String suffix) {
        return suffix.startsWith("_") ? suffix : "_" + suffix;
    }

    private static Path parentOf(Path source) {
        Path parent = source.toAbsolutePath().getParent();
        return parent == null ? Path.of(".") : parent;
    }

    record FileName(String base, String extension) {

        static FileName of(Path path) {
            Path fileName = path.getFileName();
            String name = fileName == null ? "" : fileName.toString();
            int dot = name.lastIndexOf('.');
            if (dot <= 0) {
                return new FileName(name, "");
            }
            return new FileName(name.substring(0, dot), name.substring(dot));
        }
    }
}
