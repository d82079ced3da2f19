package ai.sturdy.patcher.config;

import java.util.Optional;

/**
 * Reads patcher settings from process environment variables.
 */
public class SystemEnvironmentReader implements EnvironmentReader {

    @Override
    public Optional<String> get(String key) {
        return Optional.ofNullable(System.getenv(key));
    }
}
