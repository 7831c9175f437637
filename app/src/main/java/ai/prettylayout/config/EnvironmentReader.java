package ai.prettylayout.config;

import java.util.Optional;

/**
 * Looks up configuration values by environment variable name.
 */
@FunctionalInterface
public interface EnvironmentReader {
    Optional<String> get(String key);
}
