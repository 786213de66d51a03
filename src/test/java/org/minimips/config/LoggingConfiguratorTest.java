package org.minimips.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class LoggingConfiguratorTest {

    private final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
    private Level originalRootLevel;
    private Level originalRuntimeLevel;

    @BeforeEach
    void setUp() {
        originalRootLevel = context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel();
        originalRuntimeLevel = context.getLogger("org.minimips.runtime").getLevel();
        LoggingConfigurator.reset();
    }

    @AfterEach
    void tearDown() {
        context.getLogger(Logger.ROOT_LOGGER_NAME).setLevel(originalRootLevel);
        context.getLogger("org.minimips.runtime").setLevel(originalRuntimeLevel);
        LoggingConfigurator.reset();
    }

    @Test
    void appliesDefaultAndSpecificLevels() {
        LoggingConfigurator.configure(ConfigFactory.parseString(
                "logging { default-level = ERROR, levels { \"org.minimips.runtime\" = DEBUG } }"));

        assertThat(context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel()).isEqualTo(Level.ERROR);
        assertThat(context.getLogger("org.minimips.runtime").getLevel()).isEqualTo(Level.DEBUG);
    }

    @Test
    void secondConfigurationIsIgnored() {
        LoggingConfigurator.configure(ConfigFactory.parseString("logging.default-level = ERROR"));
        LoggingConfigurator.configure(ConfigFactory.parseString("logging.default-level = TRACE"));

        assertThat(context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel()).isEqualTo(Level.ERROR);
    }

    @Test
    void missingSectionLeavesLevelsAlone() {
        LoggingConfigurator.configure(ConfigFactory.parseString("other = 1"));

        assertThat(context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel()).isEqualTo(originalRootLevel);
    }
}
