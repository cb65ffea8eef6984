package com.metricsentinel.service;

/**
 * Typed, immutable configuration of the engine service process.
 *
 * <p>
 * Values are resolved from environment variables with sensible defaults, so
 * the service is configurable through container env vars or a shell
 * environment. The engine itself is configured by the YAML file the
 * {@code ENGINE_CONFIG_PATH} variable points at.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use {@link #fromEnvironment()} for production, or the {@link Builder}
 * for programmatic / test scenarios. The builder validates inputs at
 * {@link Builder#build()} time.
 * </p>
 *
 * @since 1.0.0
 */
public final class ServiceConfig {

    public static final String ENV_HEALTH_PORT = "HEALTH_PORT";
    public static final String ENV_ENGINE_CONFIG_PATH = "ENGINE_CONFIG_PATH";
    public static final String ENV_SHUTDOWN_TIMEOUT_SECONDS = "SHUTDOWN_TIMEOUT_SECONDS";

    private final int healthPort;

    /** YAML file for the engine; blank means the classpath default. */
    private final String engineConfigPath;

    private final int shutdownTimeoutSeconds;

    private ServiceConfig(Builder b) {
        this.healthPort = b.healthPort;
        this.engineConfigPath = b.engineConfigPath;
        this.shutdownTimeoutSeconds = b.shutdownTimeoutSeconds;
    }

    // ---------------------------------------------------------------
    // Factory, resolved from the environment
    // ---------------------------------------------------------------

    /**
     * Build a {@link ServiceConfig} from environment variables.
     *
     * @return fully populated configuration
     * @throws IllegalStateException    if an env-var value cannot be parsed
     * @throws IllegalArgumentException if a validated field is out of range
     */
    public static ServiceConfig fromEnvironment() {
        try {
            return new Builder()
                    .healthPort(parseIntEnv(ENV_HEALTH_PORT, "8080"))
                    .engineConfigPath(env(ENV_ENGINE_CONFIG_PATH, ""))
                    .shutdownTimeoutSeconds(parseIntEnv(ENV_SHUTDOWN_TIMEOUT_SECONDS, "10"))
                    .build();
        } catch (NumberFormatException e) {
            throw new IllegalStateException(
                    "Failed to parse numeric environment variable: " + e.getMessage(), e);
        }
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public int getHealthPort() {
        return healthPort;
    }

    public String getEngineConfigPath() {
        return engineConfigPath;
    }

    /**
     * @return {@code true} if an explicit engine configuration file is set
     */
    public boolean hasEngineConfigPath() {
        return !engineConfigPath.isBlank();
    }

    public int getShutdownTimeoutSeconds() {
        return shutdownTimeoutSeconds;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link ServiceConfig}.
     *
     * <p>
     * The {@link #build()} method validates that the port is in [1, 65535]
     * and the shutdown timeout is not negative.
     * </p>
     */
    public static class Builder {
        private int healthPort = 8080;
        private String engineConfigPath = "";
        private int shutdownTimeoutSeconds = 10;

        public Builder healthPort(int v) {
            this.healthPort = v;
            return this;
        }

        public Builder engineConfigPath(String v) {
            this.engineConfigPath = v;
            return this;
        }

        public Builder shutdownTimeoutSeconds(int v) {
            this.shutdownTimeoutSeconds = v;
            return this;
        }

        /**
         * Build and validate the configuration.
         *
         * @return a validated {@link ServiceConfig}
         * @throws IllegalArgumentException if any value is invalid
         */
        public ServiceConfig build() {
            if (healthPort < 1 || healthPort > 65_535) {
                throw new IllegalArgumentException(
                        "healthPort must be in [1, 65535], got: " + healthPort);
            }
            if (shutdownTimeoutSeconds < 0) {
                throw new IllegalArgumentException(
                        "shutdownTimeoutSeconds must be >= 0, got: " + shutdownTimeoutSeconds);
            }
            if (engineConfigPath == null) {
                engineConfigPath = "";
            }
            return new ServiceConfig(this);
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static String env(String name, String defaultValue) {
        String value = System.getenv(name);
        return (value != null && !value.isBlank()) ? value : defaultValue;
    }

    private static int parseIntEnv(String name, String defaultValue) {
        return Integer.parseInt(env(name, defaultValue).trim());
    }

    @Override
    public String toString() {
        return "ServiceConfig{" +
                "healthPort=" + healthPort +
                ", engineConfigPath='" + engineConfigPath + '\'' +
                ", shutdownTimeoutSeconds=" + shutdownTimeoutSeconds +
                '}';
    }
}
