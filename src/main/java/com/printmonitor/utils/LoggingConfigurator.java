package com.printmonitor.utils;

import ch.qos.logback.classic.Level;

import ch.qos.logback.classic.Logger;

import ch.qos.logback.classic.LoggerContext;

import io.vertx.core.json.JsonObject;

import org.slf4j.LoggerFactory;

import java.io.File;

/**
 * LoggingConfigurator - Applies the logging section of application.conf

 * Configuration:
 * logging {
 *   enabled = true
 *   level = "INFO"                           # TRACE, DEBUG, INFO, WARN, ERROR
 *   file.path = "logs/printmonitor.log"
 *   file.enabled = true
 *   console.enabled = true
 * }

 * The values are exported as printmonitor.log.* system properties read by logback.xml,
 * and the root and application logger levels are set directly on the logback context.
 */
public class LoggingConfigurator
{

    public static final String APPLICATION_LOGGER = "com.printmonitor";

    public static final String DEFAULT_FILE_PATH = "logs/printmonitor.log";

    private LoggingConfigurator()
    {
    }

    /**
     * Configure logging from the application configuration
     *
     * @param config application configuration root
     * @return effective level, OFF when logging is disabled
     */
    public static Level configure(JsonObject config)
    {
        var loggingConfig = config.getJsonObject("logging", new JsonObject());

        var loggingEnabled = loggingConfig.getBoolean("enabled", true);

        var logLevel = loggingConfig.getString("level", "INFO");

        // HOCON turns file.enabled into file -> enabled
        var fileConfig = loggingConfig.getJsonObject("file", new JsonObject());

        var consoleConfig = loggingConfig.getJsonObject("console", new JsonObject());

        var fileEnabled = fileConfig.getBoolean("enabled", true);

        var consoleEnabled = consoleConfig.getBoolean("enabled", true);

        var filePath = fileConfig.getString("path", DEFAULT_FILE_PATH);

        var effectiveLevel = loggingEnabled ? Level.toLevel(logLevel, Level.INFO) : Level.OFF;

        System.setProperty("printmonitor.log.level", effectiveLevel.toString());

        System.setProperty("printmonitor.log.file.path", filePath);

        System.setProperty("printmonitor.log.console.appender", consoleEnabled ? "CONSOLE" : "NULL");

        System.setProperty("printmonitor.log.file.appender", fileEnabled ? "FILE" : "NULL");

        var loggerContext = (LoggerContext) LoggerFactory.getILoggerFactory();

        loggerContext.getLogger(Logger.ROOT_LOGGER_NAME).setLevel(effectiveLevel);

        loggerContext.getLogger(APPLICATION_LOGGER).setLevel(effectiveLevel);

        if (fileEnabled && loggingEnabled)
        {
            var logDir = new File(filePath).getParentFile();

            if (logDir != null && !logDir.exists() && !logDir.mkdirs())
            {
                LoggerFactory.getLogger(LoggingConfigurator.class).warn("Could not create log directory {}", logDir);
            }
        }

        if (loggingEnabled)
        {
            LoggerFactory.getLogger(LoggingConfigurator.class)
                .info("Logging configured: level {}, console {}, file {}{}", effectiveLevel, consoleEnabled, fileEnabled,
                    fileEnabled ? " (" + filePath + ")" : "");
        }

        return effectiveLevel;
    }

}
