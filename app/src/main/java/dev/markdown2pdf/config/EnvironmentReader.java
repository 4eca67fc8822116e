package dev.markdown2pdf.config;

import java.util.Optional;

/**
 * Source of environment variables, replaceable in tests.
 */
@FunctionalInterface
public interface EnvironmentReader {

    Optional<String> get(String key);

    /**
     * The value of {@code key}, treating a blank value like an unset one.
     */
    default Optional<String> nonBlank(String key) {
        return get(key).filter(value -> !value.isBlank());
    }

    static EnvironmentReader system() {
        return key -> Optional.ofNullable(System.getenv(key));
    }
}
