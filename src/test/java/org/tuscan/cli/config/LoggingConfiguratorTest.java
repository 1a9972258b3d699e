package org.tuscan.cli.config;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import com.typesafe.config.ConfigFactory;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;

@Tag("unit")
class LoggingConfiguratorTest {

    private static final String LOGGER = "org.tuscan.test.configured";

    @AfterEach
    void tearDown() {
        ((Logger) LoggerFactory.getLogger(LOGGER)).setLevel(null);
    }

    @Test
    void appliesConfiguredLevels() {
        int applied = LoggingConfigurator.configure(ConfigFactory.parseString(
            "logging.levels { \"" + LOGGER + "\" = \"DEBUG\" }"));

        assertThat(applied).isEqualTo(1);
        assertThat(((Logger) LoggerFactory.getLogger(LOGGER)).getLevel()).isEqualTo(Level.DEBUG);
    }

    @Test
    void unknownLevelFallsBackToInfo() {
        LoggingConfigurator.configure(ConfigFactory.parseString(
            "logging.levels { \"" + LOGGER + "\" = \"LOUD\" }"));

        assertThat(((Logger) LoggerFactory.getLogger(LOGGER)).getLevel()).isEqualTo(Level.INFO);
    }

    @Test
    void missingBlockChangesNothing() {
        assertThat(LoggingConfigurator.configure(ConfigFactory.empty())).isZero();
    }
}
