package ai.sturdy.patcher.config;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable runtime configuration assembled from CLI arguments, environment values and defaults.
 */
public record Config(
        Path outputDirectory,
        Path logDirectory,
        String defaultOutputName,
        boolean versioningEnabled,
        Optional<String> versionSuffix,
        LogFormat logFormat,
        AssistantConfig assistantConfig
) {

    public Config {
        Objects.requireNonNull(outputDirectory, "outputDirectory");
        Objects.requireNonNull(logDirectory, "logDirectory");
        defaultOutputName = requireNonBlank(defaultOutputName, "defaultOutputName");
        if (defaultOutputName.contains("/") || defaultOutputName.contains("\\")) {
            throw new IllegalArgumentException("defaultOutputName must be a plain file name");
        }
        versionSuffix = versionSuffix == null ? Optional.empty() : versionSuffix.map(String::trim).filter(value -> !value.isEmpty());
        logFormat = Objects.requireNonNull(logFormat, "logFormat");
        assistantConfig = Objects.requireNonNull(assistantConfig, "assistantConfig");
    }

    private static String requireNonBlank(String value, String fieldName) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(fieldName + " must not be blank");
        }
        return value.trim();
    }
}
