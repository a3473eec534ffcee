package io.meshpager.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.FileAppender;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;

/**
 * Applies the configured level and log file to the Logback root logger once configuration has been
 * loaded. The console appender comes from {@code logback.xml}.
 */
public final class LoggingConfigurator {
    public static final String PATTERN = "%d{yyyy-MM-dd HH:mm:ss.SSS} - %level %marker - [%logger{0}:%line] - %msg%n";
    public static final String FILE_APPENDER_NAME = "MESHPAGER_FILE";

    private static final org.slf4j.Logger log = LoggerFactory.getLogger(LoggingConfigurator.class);

    private LoggingConfigurator() {
    }

    public static void apply(String level, Path logFile) {
        ILoggerFactory factory = LoggerFactory.getILoggerFactory();
        if (!(factory instanceof LoggerContext context)) {
            log.warn("Logging backend {} does not support runtime configuration; keeping defaults",
                    factory.getClass().getName());
            return;
        }
        Logger root = context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
        root.setLevel(Level.toLevel(level, Level.INFO));
        if (logFile != null && root.getAppender(FILE_APPENDER_NAME) == null) {
            root.addAppender(fileAppender(context, logFile));
        }
        log.info("Logging initialized (level={}, file={})", root.getLevel(), logFile);
    }

    private static FileAppender<ILoggingEvent> fileAppender(LoggerContext context, Path logFile) {
        PatternLayoutEncoder encoder = new PatternLayoutEncoder();
        encoder.setContext(context);
        encoder.setPattern(PATTERN);
        encoder.start();

        FileAppender<ILoggingEvent> appender = new FileAppender<>();
        appender.setContext(context);
        appender.setName(FILE_APPENDER_NAME);
        appender.setFile(logFile.toAbsolutePath().toString());
        appender.setAppend(true);
        appender.setEncoder(encoder);
        appender.start();
        return appender;
    }
}
