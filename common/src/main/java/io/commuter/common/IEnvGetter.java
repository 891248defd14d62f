package io.commuter.common;

/**
 * Abstraction for reading environment variables or configuration values.
 * <p>
 * Used to avoid direct calls to {@link System#getenv(String)} in code,
 * so that unit tests can provide their own environment source.
 */
@FunctionalInterface
public interface IEnvGetter {
    /**
     * Default implementation backed by {@link System#getenv(String)}.
     */
    IEnvGetter env = System::getenv;

    /**
     * Returns the value of the given environment variable, or {@code null} if unset.
     */
    String get(String name);

    static boolean getBooleanOr(IEnvGetter env, String name, boolean defaultValue) {
        String value = env.get(name);
        return (value != null && !value.isBlank()) ? Boolean.parseBoolean(value.trim()) : defaultValue;
    }

    static int getIntOr(IEnvGetter env, String name, int defaultValue) {
        String value = env.get(name);
        if (value == null || value.isBlank()) return defaultValue;
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalStateException("Invalid integer for environment variable: " + name + " = '" + value + "'", e);
        }
    }
}
