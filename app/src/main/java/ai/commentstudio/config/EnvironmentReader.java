package ai.commentstudio.config;

import java.util.Optional;

/**
 * Source of environment values; tests supply a map-backed lambda.
 */
@FunctionalInterface
public interface EnvironmentReader {

    Optional<String> get(String key);

    static EnvironmentReader system() {
        return key -> Optional.ofNullable(System.getenv(key));
    }

    /**
     * Returns the trimmed value, treating blank values as absent.
     */
    default Optional<String> value(String key) {
        return get(key).map(String::trim).filter(value -> !value.isEmpty());
    }
}
