package org.tuscan.cli.config;

import java.util.Map;

import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigValue;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;

/**
 * Applies per-logger levels from the {@code logging.levels} block, e.g.
 * <pre>
 * logging.levels {
 *   "org.tuscan" = "DEBUG"
 *   "org.tuscan.pipeline.ScoringWorker" = "WARN"
 * }
 * </pre>
 * Unknown level names fall back to {@code INFO}.
 */
public final class LoggingConfigurator {

    private LoggingConfigurator() {
    }

    /**
     * @param config the application configuration.
     * @return the number of loggers whose level was set.
     */
    public static int configure(Config config) {
        if (!config.hasPath("logging.levels")) {
            return 0;
        }
        if (!(LoggerFactory.getILoggerFactory() instanceof LoggerContext context)) {
            return 0;
        }
        int applied = 0;
        // root() keeps quoted keys such as "org.tuscan" as single entries
        for (Map.Entry<String, ConfigValue> entry : config.getConfig("logging.levels").root().entrySet()) {
            Logger logger = context.getLogger(entry.getKey());
            logger.setLevel(Level.toLevel(String.valueOf(entry.getValue().unwrapped()), Level.INFO));
            applied++;
        }
        return applied;
    }
}
