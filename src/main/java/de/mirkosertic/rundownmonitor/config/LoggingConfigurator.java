package de.mirkosertic.rundownmonitor.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.joran.JoranConfigurator;
import ch.qos.logback.core.joran.spi.JoranException;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Applies the logging section of the configuration.
 * <p>
 * Without a log file the console setup of logback.xml stays in place. With a log file,
 * logback-file.xml is loaded, which logs to the console and to that file.
 */
public final class LoggingConfigurator {

    private static final String FILE_CONFIG = "logback-file.xml";
    static final String LOG_FILE_PROPERTY = "LOG_FILE";

    private LoggingConfigurator() {
    }

    /**
     * Must be called right after the configuration is loaded.
     *
     * @param level   root log level, e.g. {@code INFO}; unknown names fall back to INFO
     * @param logFile file to log to in addition to the console, or null
     */
    public static void configure(final String level, final @Nullable String logFile) {
        final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        if (logFile != null) {
            ensureLogDirectoryExists(logFile);
            loadConfiguration(context, FILE_CONFIG, logFile);
        }
        context.getLogger(Logger.ROOT_LOGGER_NAME).setLevel(Level.toLevel(level, Level.INFO));
    }

    private static void ensureLogDirectoryExists(final String logFile) {
        final Path parent = Paths.get(logFile).toAbsolutePath().getParent();
        if (parent == null || Files.exists(parent)) {
            return;
        }
        try {
            Files.createDirectories(parent);
        } catch (final IOException e) {
            System.err.println("Warning: Could not create log directory: " + parent);
        }
    }

    private static void loadConfiguration(final LoggerContext context, final String configFile, final String logFile) {
        try {
            context.reset();
            context.putProperty(LOG_FILE_PROPERTY, logFile);

            final JoranConfigurator configurator = new JoranConfigurator();
            configurator.setContext(context);

            try (InputStream configStream = LoggingConfigurator.class.getClassLoader()
                    .getResourceAsStream(configFile)) {
                if (configStream != null) {
                    configurator.doConfigure(configStream);
                } else {
                    System.err.println("Warning: Could not find " + configFile + " on classpath");
                }
            }
        } catch (final JoranException e) {
            System.err.println("Warning: Error loading logback configuration: " + e.getMessage());
        } catch (final IOException e) {
            System.err.println("Warning: Unexpected error configuring logging: " + e.getMessage());
        }
    }
}
