package com.chunkr.runtime;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;

public final class LoggingConfigurator {
    private static final Logger log = LoggerFactory.getLogger(LoggingConfigurator.class);

    private LoggingConfigurator() {
    }

    public static void apply(AppConfig.LoggingConfig config) {
        if (!(LoggerFactory.getILoggerFactory() instanceof LoggerContext context)) {
            log.debug("Logback not bound, leaving log level untouched");
            return;
        }
        Level level = Level.toLevel(config.getLevel(), Level.INFO);
        context.getLogger(Logger.ROOT_LOGGER_NAME).setLevel(level);
        log.debug("Root log level set to {}", level);
    }
}
