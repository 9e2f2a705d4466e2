package com.jedi.catalog.pipeline;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.FileAppender;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;

/**
 * Copies the application's log output of one verbose catalog run into
 * {@value #FILE_NAME} next to the catalog. Detached again on close.
 */
@Slf4j
final class RunLogFile implements AutoCloseable {

    static final String FILE_NAME = "generate_jedi_catalog.log";

    private static final String LOGGER_NAME = "com.jedi.catalog";
    private static final String PATTERN = "%d{yyyy-MM-dd HH:mm:ss.SSS} %-5level %logger{36} - %msg%n";

    private final Logger logger;
    private final FileAppender<ILoggingEvent> appender;

    private RunLogFile(Logger logger, FileAppender<ILoggingEvent> appender) {
        this.logger = logger;
        this.appender = appender;
    }

    static RunLogFile disabled() {
        return new RunLogFile(null, null);
    }

    static RunLogFile open(Path directory) {
        if (!(LoggerFactory.getILoggerFactory() instanceof LoggerContext context)) {
            log.warn("Logging backend is not Logback, no run log written to {}", directory);
            return disabled();
        }

        PatternLayoutEncoder encoder = new PatternLayoutEncoder();
        encoder.setContext(context);
        encoder.setPattern(PATTERN);
        encoder.start();

        FileAppender<ILoggingEvent> appender = new FileAppender<>();
        appender.setContext(context);
        appender.setName("catalog-run-log");
        appender.setFile(directory.resolve(FILE_NAME).toString());
        appender.setAppend(true);
        appender.setEncoder(encoder);
        appender.start();

        Logger logger = context.getLogger(LOGGER_NAME);
        logger.addAppender(appender);
        log.info("Writing run log to {}", directory.resolve(FILE_NAME));
        return new RunLogFile(logger, appender);
    }

    @Override
    public void close() {
        if (appender != null) {
            logger.detachAppender(appender);
            appender.stop();
        }
    }
}
