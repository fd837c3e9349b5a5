package de.mirkosertic.rundownmonitor;

import com.fasterxml.jackson.databind.ObjectMapper;
import de.mirkosertic.rundownmonitor.asset.TweetAssetFetcher;
import de.mirkosertic.rundownmonitor.config.ApplicationConfig;
import de.mirkosertic.rundownmonitor.config.ContentSettings;
import de.mirkosertic.rundownmonitor.config.FeedSettings;
import de.mirkosertic.rundownmonitor.config.LoggingConfigurator;
import de.mirkosertic.rundownmonitor.feed.ChangeReportLogger;
import de.mirkosertic.rundownmonitor.feed.FeedReader;
import de.mirkosertic.rundownmonitor.feed.FeedWatcher;
import de.mirkosertic.rundownmonitor.feed.FtpFeedReader;
import de.mirkosertic.rundownmonitor.label.LabelParser;
import de.mirkosertic.rundownmonitor.monitor.RundownMonitorService;
import de.mirkosertic.rundownmonitor.reconcile.ReconciliationService;
import de.mirkosertic.rundownmonitor.reconcile.ReconciliationState;
import de.mirkosertic.rundownmonitor.reconcile.ReferenceIndexWriter;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Main entry point for the rundown monitor.
 * Wires the services from the configuration and runs either a single round ({@code --once})
 * or the control loop until the JVM shuts down.
 */
public class RundownMonitorApplication {

    private static final Logger logger = LoggerFactory.getLogger(RundownMonitorApplication.class);

    private final FeedReader reader;
    private final RundownMonitorService monitorService;

    public RundownMonitorApplication(final ApplicationConfig config, final Clock clock) throws IOException {
        final ContentSettings content = config.getContentSettings();
        final ObjectMapper objectMapper = new ObjectMapper();

        // Initialize services in dependency order
        Files.createDirectories(content.downloadBasePath());
        final ReconciliationState state = ReconciliationState.load(content.downloadBasePath(), objectMapper, clock);
        final ReconciliationService reconciliationService = new ReconciliationService(
                state,
                new TweetAssetFetcher(content, objectMapper),
                new ReferenceIndexWriter(content.downloadBasePath()),
                content.downloadBasePath()
        );

        this.reader = new FtpFeedReader(config.getServerSettings());

        final LabelParser labelParser = new LabelParser();
        final List<FeedWatcher> watchers = new ArrayList<>();
        for (final FeedSettings feed : config.getFeeds()) {
            watchers.add(new FeedWatcher(feed, reader, labelParser, clock));
            logger.info("Watching rundown {} at {} every {}s", feed.name(), feed.path(), feed.intervalSeconds());
        }

        this.monitorService = new RundownMonitorService(
                reader,
                watchers,
                reconciliationService,
                new ChangeReportLogger(),
                config.getLoopDelayMs()
        );
    }

    /**
     * Run one round and disconnect.
     */
    public void runOnce() {
        logger.info("Running a single round...");
        monitorService.runOnce();
        logger.info("Single round finished");
    }

    /**
     * Start the control loop and block until it is stopped by the shutdown hook.
     */
    public void start() {
        Runtime.getRuntime().addShutdownHook(new Thread(this::shutdown, "shutdown-hook"));
        monitorService.start();
    }

    /**
     * Shutdown all services gracefully.
     */
    public void shutdown() {
        logger.info("Shutting down rundown monitor...");
        try {
            monitorService.stop();
        } catch (final RuntimeException e) {
            logger.error("Error stopping monitor", e);
        }
        logger.info("Rundown monitor shutdown complete");
    }

    public static void main(final String[] args) {
        try {
            final CommandLine commandLine = CommandLine.parse(args);

            final ApplicationConfig config = ApplicationConfig.load(commandLine.configFile());
            LoggingConfigurator.configure(config.getLogLevel(), config.getLogFile());

            final RundownMonitorApplication app = new RundownMonitorApplication(config, Clock.systemDefaultZone());
            if (commandLine.once()) {
                app.runOnce();
            } else {
                app.start();
            }
        } catch (final Exception e) {
            System.err.println("Failed to start rundown monitor: " + e.getMessage());
            e.printStackTrace(System.err);
            System.exit(1);
        }
    }

    /**
     * Parsed command line: {@code [--once] [--config <file>]}.
     */
    record CommandLine(boolean once, @Nullable Path configFile) {

        static CommandLine parse(final String[] args) {
            boolean once = false;
            Path configFile = null;
            for (int i = 0; i < args.length; i++) {
                final String arg = args[i];
                if ("--once".equals(arg)) {
                    once = true;
                } else if ("--config".equals(arg)) {
                    if (i + 1 >= args.length) {
                        throw new IllegalArgumentException("--config needs a file argument");
                    }
                    configFile = Paths.get(args[++i]);
                } else if (arg.startsWith("--config=")) {
                    configFile = Paths.get(arg.substring("--config=".length()));
                } else {
                    throw new IllegalArgumentException("Unknown argument: " + arg
                            + " (usage: [--once] [--config <file>])");
                }
            }
            return new CommandLine(once, configFile);
        }
    }
}
