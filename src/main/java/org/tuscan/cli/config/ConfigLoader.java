package org.tuscan.cli.config;

import java.io.File;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

/**
 * Central configuration loader for the command line.
 * <p>
 * Composes HOCON configuration from multiple sources with the following precedence
 * (highest to lowest):
 * <ol>
 *   <li>Java system properties ({@code -Dkey=value})</li>
 *   <li>Environment variables</li>
 *   <li>User configuration file (see {@link #resolve(File, ConfigMessageHandler)})</li>
 *   <li>Default reference configuration ({@code reference.conf} on the classpath)</li>
 * </ol>
 * <p>
 * Uses {@link ConfigFactory#defaultReferenceUnresolved()} to defer substitution resolution
 * until after all layers are composed, so user overrides reach every substitution in
 * {@code reference.conf}.
 */
public final class ConfigLoader {

    static final String CONFIG_DIR = "config";
    static final String CONFIG_FILE_NAME = "tuscan.conf";
    static final String CONFIG_ENV_VARIABLE = "TUSCAN_CONFIG";

    private ConfigLoader() {
    }

    /**
     * Message severity levels for configuration resolution feedback.
     */
    public enum MessageLevel {
        /** Informational progress (e.g., which config file was selected). */
        INFO,
        /** Warning about fallback behavior (e.g., no config file found). */
        WARN
    }

    /**
     * Callback for receiving progress messages during configuration file resolution.
     */
    @FunctionalInterface
    public interface ConfigMessageHandler {

        /**
         * Called with a status message during the config resolution cascade.
         *
         * @param level   the severity of the message.
         * @param message the human-readable description.
         */
        void log(MessageLevel level, String message);
    }

    /**
     * Resolves configuration using the fallback cascade:
     * <ol>
     *   <li><strong>Explicit file:</strong> config file passed via CLI {@code --config} option</li>
     *   <li><strong>Environment:</strong> path in the {@code TUSCAN_CONFIG} variable</li>
     *   <li><strong>Working directory:</strong> {@code config/tuscan.conf} relative to CWD</li>
     *   <li><strong>Classpath defaults:</strong> {@code reference.conf} only</li>
     * </ol>
     *
     * @param explicitConfigFile config file from CLI option, or {@code null} for auto-discovery.
     * @param handler            callback for resolution progress messages.
     * @return the fully resolved application {@link Config}.
     * @throws IllegalArgumentException            if an explicitly specified config file does not exist.
     * @throws com.typesafe.config.ConfigException if the configuration cannot be parsed or resolved.
     */
    public static Config resolve(final File explicitConfigFile, final ConfigMessageHandler handler) {
        return resolve(explicitConfigFile, System.getenv(CONFIG_ENV_VARIABLE), new File(CONFIG_DIR, CONFIG_FILE_NAME), handler);
    }

    static Config resolve(final File explicitConfigFile, final String environmentPath,
                          final File workingDirectoryFile, final ConfigMessageHandler handler) {
        if (explicitConfigFile != null) {
            if (!explicitConfigFile.exists()) {
                throw new IllegalArgumentException(
                        "Configuration file not found: " + explicitConfigFile.getAbsolutePath());
            }
            handler.log(MessageLevel.INFO,
                    "Using configuration file specified via --config: " + explicitConfigFile.getAbsolutePath());
            return loadFromFile(explicitConfigFile);
        }

        if (environmentPath != null && !environmentPath.isBlank()) {
            final File environmentFile = new File(environmentPath).getAbsoluteFile();
            if (!environmentFile.exists()) {
                throw new IllegalArgumentException(
                        "Configuration file specified via " + CONFIG_ENV_VARIABLE + " not found: "
                                + environmentFile.getAbsolutePath());
            }
            handler.log(MessageLevel.INFO,
                    "Using configuration file specified via " + CONFIG_ENV_VARIABLE + ": " + environmentFile.getAbsolutePath());
            return loadFromFile(environmentFile);
        }

        if (workingDirectoryFile.exists()) {
            handler.log(MessageLevel.INFO,
                    "Using configuration file found in current directory: " + workingDirectoryFile.getAbsolutePath());
            return loadFromFile(workingDirectoryFile);
        }

        handler.log(MessageLevel.WARN,
                "No '" + CONFIG_DIR + "/" + CONFIG_FILE_NAME + "' found in current directory, "
                        + "using default configuration from classpath.");
        return loadDefaults();
    }

    /**
     * Loads configuration from a file, merged with classpath defaults.
     *
     * @param configFile the configuration file to load.
     * @return the fully resolved application {@link Config}.
     */
    static Config loadFromFile(final File configFile) {
        return ConfigFactory.systemProperties()
            .withFallback(ConfigFactory.systemEnvironment())
            .withFallback(ConfigFactory.parseFile(configFile))
            .withFallback(ConfigFactory.defaultReferenceUnresolved())
            .resolve();
    }

    /**
     * Loads configuration from classpath defaults only (no user config file).
     *
     * @return the fully resolved application {@link Config}.
     */
    public static Config loadDefaults() {
        return ConfigFactory.systemProperties()
            .withFallback(ConfigFactory.systemEnvironment())
            .withFallback(ConfigFactory.defaultReferenceUnresolved())
            .resolve();
    }
}
