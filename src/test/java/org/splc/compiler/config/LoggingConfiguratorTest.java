package org.splc.compiler.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import com.typesafe.config.ConfigFactory;
import org.splc.junit.extensions.logging.ExpectLog;
import org.splc.junit.extensions.logging.LogLevel;
import org.splc.junit.extensions.logging.LogWatchExtension;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.slf4j.LoggerFactory;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
public class LoggingConfiguratorTest {

    private static final String PROBE = "org.splc.compiler.config.probe";

    private LoggerContext context;
    private Level rootLevel;

    @BeforeEach
    void setUp() {
        context = (LoggerContext) LoggerFactory.getILoggerFactory();
        rootLevel = context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel();
        LoggingConfigurator.reset();
    }

    @AfterEach
    void tearDown() {
        context.getLogger(Logger.ROOT_LOGGER_NAME).setLevel(rootLevel);
        context.getLogger(PROBE).setLevel(null);
        LoggingConfigurator.reset();
    }

    @Test
    void appliesDefaultAndPerLoggerLevels() {
        // Arrange
        var config = ConfigFactory.parseString(
                "logging { default-level = ERROR, levels { \"" + PROBE + "\" = TRACE } }");

        // Act
        LoggingConfigurator.configure(config);

        // Assert
        assertThat(context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel()).isEqualTo(Level.ERROR);
        assertThat(context.getLogger(PROBE).getLevel()).isEqualTo(Level.TRACE);
    }

    @Test
    void secondCallIsIgnoredUntilReset() {
        // Arrange
        LoggingConfigurator.configure(ConfigFactory.parseString("logging.levels { \"" + PROBE + "\" = INFO }"));

        // Act
        LoggingConfigurator.configure(ConfigFactory.parseString("logging.levels { \"" + PROBE + "\" = ERROR }"));

        // Assert
        assertThat(context.getLogger(PROBE).getLevel()).isEqualTo(Level.INFO);
    }

    @Test
    @ExpectLog(level = LogLevel.WARN, loggerPattern = ".*LoggingConfigurator", messagePattern = "Ignoring unknown level 'LOUD'.*")
    void unknownLevelIsSkippedWithAWarning() {
        // Act
        LoggingConfigurator.configure(ConfigFactory.parseString("logging.levels { \"" + PROBE + "\" = LOUD }"));

        // Assert
        assertThat(context.getLogger(PROBE).getLevel()).isNull();
    }
}
