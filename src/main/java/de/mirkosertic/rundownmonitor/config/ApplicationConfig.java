package de.mirkosertic.rundownmonitor.config;

import de.mirkosertic.rundownmonitor.label.LabelParser;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.math.BigInteger;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.function.Function;

/**
 * Central configuration for the rundown monitor.
 * Loads configuration from YAML files, system properties and environment variables.
 * <p>
 * Configuration priority (highest to lowest):
 * 1. Environment variables
 * 2. System properties
 * 3. Config file ({@code --config <file>}, default {@code ./config.yaml})
 * 4. Application defaults (application.yaml in classpath)
 * <p>
 * The configuration is validated once after loading; an invalid configuration raises a
 * {@link ConfigurationException} before anything connects anywhere.
 */
public class ApplicationConfig {

    private static final Logger logger = LoggerFactory.getLogger(ApplicationConfig.class);

    private static final String ENV_HOST = "RUNDOWN_HOST";
    private static final String ENV_USER = "RUNDOWN_USER";
    private static final String ENV_PASSWORD = "RUNDOWN_PASSWORD";
    private static final String ENV_DOWNLOAD_PATH = "RUNDOWN_DOWNLOAD_PATH";
    private static final String ENV_BEARER_TOKEN = "TWITTER_BEARER_TOKEN";

    private static final String PROP_PREFIX = "rundown.";
    public static final String DEFAULT_CONFIG_FILE = "config.yaml";
    private static final String CLASSPATH_CONFIG_FILE = "application.yaml";
    static final String LEGACY_FEED_NAME = "DEFAULT";

    private final Function<String, String> environment;
    private final Properties systemProperties;

    // Server settings
    private String host;
    private int port = 21;
    private String user;
    private String password = "";
    private int timeoutSeconds = 30;
    private String encoding = "UTF-8";
    private String legacyRundownPath;

    // Monitor defaults, applied to every feed that does not set its own
    private long intervalSeconds = 30;
    private String filter = LabelParser.ALLOWED_KINDS_FILTER;
    private List<String> allowedKinds = LabelParser.DEFAULT_ALLOWED_KINDS;
    private long loopDelayMs = 1000;

    private List<Map<String, Object>> feedDefinitions = new ArrayList<>();

    // Content settings
    private String downloadBasePath;
    private String bearerToken;
    private String apiBaseUrl = "https://api.twitter.com/2";
    private int requestTimeoutSeconds = 30;

    // Logging
    private String logLevel = "INFO";
    private String logFile;

    // Resolved after validation
    private ServerSettings serverSettings;
    private List<FeedSettings> feeds = List.of();
    private ContentSettings contentSettings;

    private ApplicationConfig(final Function<String, String> environment, final Properties systemProperties) {
        this.environment = environment;
        this.systemProperties = systemProperties;
    }

    /**
     * Load configuration from all sources with proper priority.
     *
     * @param configFile the file passed on the command line, or null for {@code ./config.yaml}
     * @throws ConfigurationException if the configuration is unreadable or invalid
     */
    public static ApplicationConfig load(final @Nullable Path configFile) {
        return load(configFile, System::getenv, System.getProperties());
    }

    static ApplicationConfig load(final @Nullable Path configFile,
                                  final Function<String, String> environment,
                                  final Properties systemProperties) {
        final ApplicationConfig config = new ApplicationConfig(environment, systemProperties);

        // Step 1: Load application defaults from classpath
        config.loadFromClasspath();

        // Step 2: Load the config file (may override some settings)
        config.loadFromFile(configFile);

        // Step 3: Apply system properties and environment variables (highest priority)
        config.applySystemPropertyOverrides();
        config.applyEnvironmentOverrides();

        // Step 4: Validate and build the settings
        config.validate();

        logger.info("Configuration loaded: server={}, feeds={}, downloadBasePath={}",
                config.serverSettings, config.feeds.size(), config.contentSettings.downloadBasePath());

        return config;
    }

    private void loadFromClasspath() {
        try (final InputStream is = getClass().getClassLoader().getResourceAsStream(CLASSPATH_CONFIG_FILE)) {
            if (is != null) {
                applyYamlConfig(parse(is, CLASSPATH_CONFIG_FILE));
                logger.debug("Loaded defaults from classpath: {}", CLASSPATH_CONFIG_FILE);
            }
        } catch (final IOException e) {
            logger.warn("Failed to load default config from classpath", e);
        }
    }

    private void loadFromFile(final @Nullable Path configFile) {
        final Path path = configFile != null ? configFile : Paths.get(DEFAULT_CONFIG_FILE);
        if (!Files.exists(path)) {
            if (configFile != null) {
                throw new ConfigurationException("Config file not found: " + configFile.toAbsolutePath());
            }
            logger.debug("No config file at {}, using defaults and environment", path.toAbsolutePath());
            return;
        }
        try (final InputStream is = Files.newInputStream(path)) {
            applyYamlConfig(parse(is, path.toString()));
            logger.debug("Loaded config from: {}", path.toAbsolutePath());
        } catch (final IOException e) {
            throw new ConfigurationException("Failed to read config file " + path.toAbsolutePath(), e);
        }
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> parse(final InputStream is, final String source) {
        try {
            final Object loaded = new Yaml().load(is);
            if (loaded == null) {
                return Collections.emptyMap();
            }
            if (!(loaded instanceof Map)) {
                throw new ConfigurationException("Config " + source + " is not a YAML mapping");
            }
            return (Map<String, Object>) loaded;
        } catch (final YAMLException e) {
            throw new ConfigurationException("Config " + source + " is not valid YAML: " + e.getMessage(), e);
        }
    }

    private void applyYamlConfig(final Map<String, Object> config) {
        // Navigate to rundown section
        final Map<String, Object> rundownConfig = section(config, "rundown");
        if (rundownConfig == null) {
            return;
        }

        final Map<String, Object> serverConfig = section(rundownConfig, "server");
        if (serverConfig != null) {
            host = stringValue(serverConfig, "host", host);
            port = intValue(serverConfig, "port", port);
            user = stringValue(serverConfig, "user", user);
            password = stringValue(serverConfig, "password", password);
            timeoutSeconds = intValue(serverConfig, "timeout-seconds", timeoutSeconds);
            encoding = stringValue(serverConfig, "encoding", encoding);
            legacyRundownPath = stringValue(serverConfig, "rundown-path", legacyRundownPath);
        }

        final Map<String, Object> monitorConfig = section(rundownConfig, "monitor");
        if (monitorConfig != null) {
            intervalSeconds = longValue(monitorConfig, "interval-seconds", intervalSeconds);
            filter = stringValue(monitorConfig, "filter", filter);
            allowedKinds = stringList(monitorConfig, "allowed-kinds", allowedKinds);
            loopDelayMs = longValue(monitorConfig, "loop-delay-ms", loopDelayMs);
        }

        if (rundownConfig.containsKey("feeds")) {
            feedDefinitions = feedList(rundownConfig.get("feeds"));
        }

        final Map<String, Object> contentConfig = section(rundownConfig, "content");
        if (contentConfig != null) {
            downloadBasePath = stringValue(contentConfig, "download-base-path", downloadBasePath);
            bearerToken = stringValue(contentConfig, "bearer-token", bearerToken);
            apiBaseUrl = stringValue(contentConfig, "api-base-url", apiBaseUrl);
            requestTimeoutSeconds = intValue(contentConfig, "request-timeout-seconds", requestTimeoutSeconds);
        }

        final Map<String, Object> loggingConfig = section(rundownConfig, "logging");
        if (loggingConfig != null) {
            logLevel = stringValue(loggingConfig, "level", logLevel);
            logFile = stringValue(loggingConfig, "file", logFile);
        }
    }

    private void applySystemPropertyOverrides() {
        host = property("server.host", host);
        user = property("server.user", user);
        password = property("server.password", password);
        downloadBasePath = property("content.download-base-path", downloadBasePath);
        bearerToken = property("content.bearer-token", bearerToken);
        logLevel = property("logging.level", logLevel);
        logFile = property("logging.file", logFile);
    }

    private void applyEnvironmentOverrides() {
        host = env(ENV_HOST, host);
        user = env(ENV_USER, user);
        password = env(ENV_PASSWORD, password);
        downloadBasePath = env(ENV_DOWNLOAD_PATH, downloadBasePath);
        bearerToken = env(ENV_BEARER_TOKEN, bearerToken);
    }

    private String property(final String key, final String current) {
        final String value = systemProperties.getProperty(PROP_PREFIX + key);
        return value != null && !value.isEmpty() ? value : current;
    }

    private String env(final String name, final String current) {
        final String value = environment.apply(name);
        if (value != null && !value.trim().isEmpty()) {
            logger.debug("{} taken from environment", name);
            return value.trim();
        }
        return current;
    }

    private void validate() {
        if (isBlank(host)) {
            throw new ConfigurationException("rundown.server.host is required (or set " + ENV_HOST + ")");
        }
        if (isBlank(user)) {
            throw new ConfigurationException("rundown.server.user is required (or set " + ENV_USER + ")");
        }
        if (port <= 0 || port > 65535) {
            throw new ConfigurationException("rundown.server.port is out of range: " + port);
        }
        if (timeoutSeconds <= 0) {
            throw new ConfigurationException("rundown.server.timeout-seconds must be positive");
        }
        if (loopDelayMs <= 0) {
            throw new ConfigurationException("rundown.monitor.loop-delay-ms must be positive");
        }
        if (isBlank(downloadBasePath)) {
            throw new ConfigurationException("rundown.content.download-base-path is required (or set "
                    + ENV_DOWNLOAD_PATH + ")");
        }
        if (isBlank(bearerToken)) {
            throw new ConfigurationException("rundown.content.bearer-token is required (or set "
                    + ENV_BEARER_TOKEN + ")");
        }
        if (requestTimeoutSeconds <= 0) {
            throw new ConfigurationException("rundown.content.request-timeout-seconds must be positive");
        }

        this.serverSettings = new ServerSettings(host, port, user, password == null ? "" : password,
                timeoutSeconds, encoding);
        this.feeds = buildFeeds();
        this.contentSettings = new ContentSettings(Paths.get(downloadBasePath).toAbsolutePath().normalize(),
                bearerToken, apiBaseUrl, requestTimeoutSeconds);
    }

    private List<FeedSettings> buildFeeds() {
        final List<FeedSettings> result = new ArrayList<>();

        // Legacy single rundown configured next to the server
        if (!isBlank(legacyRundownPath)) {
            result.add(feed(LEGACY_FEED_NAME, legacyRundownPath, intervalSeconds, filter, allowedKinds));
        }

        for (int i = 0; i < feedDefinitions.size(); i++) {
            final Map<String, Object> definition = feedDefinitions.get(i);
            final String name = stringValue(definition, "name", "FEED_" + (i + 1));
            final String path = stringValue(definition, "path", null);
            if (isBlank(path)) {
                throw new ConfigurationException("Feed " + name + " has no path");
            }
            result.add(feed(name,
                    path,
                    longValue(definition, "interval-seconds", intervalSeconds),
                    stringValue(definition, "filter", filter),
                    stringList(definition, "allowed-kinds", allowedKinds)));
        }

        if (result.isEmpty()) {
            throw new ConfigurationException("At least one feed must be configured under rundown.feeds");
        }
        return List.copyOf(result);
    }

    private static FeedSettings feed(final String name, final String path, final long interval,
                                     final String filter, final List<String> allowedKinds) {
        if (interval <= 0) {
            throw new ConfigurationException("Feed " + name + " needs a positive interval-seconds, got " + interval);
        }
        return new FeedSettings(name, path, interval, filter == null ? "" : filter, allowedKinds);
    }

    @SuppressWarnings("unchecked")
    private static @Nullable Map<String, Object> section(final Map<String, Object> config, final String key) {
        final Object value = config.get(key);
        if (value == null) {
            return null;
        }
        if (!(value instanceof Map)) {
            throw new ConfigurationException("'" + key + "' must be a mapping");
        }
        return (Map<String, Object>) value;
    }

    @SuppressWarnings("unchecked")
    private static List<Map<String, Object>> feedList(final Object value) {
        if (value == null) {
            return new ArrayList<>();
        }
        if (!(value instanceof List)) {
            throw new ConfigurationException("'feeds' must be a list");
        }
        final List<Map<String, Object>> result = new ArrayList<>();
        for (final Object item : (List<Object>) value) {
            if (!(item instanceof Map)) {
                throw new ConfigurationException("Every entry of 'feeds' must be a mapping");
            }
            result.add((Map<String, Object>) item);
        }
        return result;
    }

    private String stringValue(final Map<String, Object> config, final String key, final String current) {
        final Object value = config.get(key);
        if (value == null) {
            return current;
        }
        return resolveVariables(value.toString());
    }

    private int intValue(final Map<String, Object> config, final String key, final int current) {
        final long value = longValue(config, key, current);
        try {
            return Math.toIntExact(value);
        } catch (final ArithmeticException e) {
            throw new ConfigurationException("'" + key + "' is out of range: " + value, e);
        }
    }

    private long longValue(final Map<String, Object> config, final String key, final long current) {
        final Object value = config.get(key);
        if (value == null) {
            return current;
        }
        if (value instanceof BigInteger) {
            try {
                return ((BigInteger) value).longValueExact();
            } catch (final ArithmeticException e) {
                throw new ConfigurationException("'" + key + "' is out of range: " + value, e);
            }
        }
        if (value instanceof Number) {
            return ((Number) value).longValue();
        }
        final String resolved = resolveVariables(value.toString()).trim();
        try {
            return Long.parseLong(resolved);
        } catch (final NumberFormatException e) {
            throw new ConfigurationException("'" + key + "' must be a number, got '" + resolved + "'", e);
        }
    }

    private List<String> stringList(final Map<String, Object> config, final String key, final List<String> current) {
        final Object value = config.get(key);
        if (value == null) {
            return current;
        }
        final List<String> result = new ArrayList<>();
        if (value instanceof List) {
            for (final Object item : (List<?>) value) {
                if (item != null) {
                    result.add(resolveVariables(item.toString()).trim());
                }
            }
        } else {
            for (final String item : resolveVariables(value.toString()).split(",")) {
                if (!item.trim().isEmpty()) {
                    result.add(item.trim());
                }
            }
        }
        return List.copyOf(result);
    }

    /**
     * Resolve variables in strings like ${VAR:default}
     */
    String resolveVariables(final String value) {
        if (value == null || !value.contains("${")) {
            return value;
        }

        String result = value;
        int start;
        while ((start = result.indexOf("${")) >= 0) {
            final int end = result.indexOf("}", start);
            if (end < 0) {
                break;
            }

            final String varExpr = result.substring(start + 2, end);
            final String[] parts = varExpr.split(":", 2);
            final String varName = parts[0];
            final String defaultValue = parts.length > 1 ? parts[1] : "";

            // Check environment first, then system properties
            String replacement = environment.apply(varName);
            if (replacement == null || replacement.isEmpty()) {
                replacement = systemProperties.getProperty(varName, defaultValue);
            }

            // Handle nested ${user.home} type variables
            if (replacement.contains("${")) {
                replacement = resolveVariables(replacement);
            }

            result = result.substring(0, start) + replacement + result.substring(end + 1);
        }

        return result;
    }

    private static boolean isBlank(final @Nullable String value) {
        return value == null || value.trim().isEmpty();
    }

    // Getters
    public ServerSettings getServerSettings() {
        return serverSettings;
    }

    public List<FeedSettings> getFeeds() {
        return feeds;
    }

    public ContentSettings getContentSettings() {
        return contentSettings;
    }

    public long getLoopDelayMs() {
        return loopDelayMs;
    }

    public String getLogLevel() {
        return logLevel;
    }

    public @Nullable String getLogFile() {
        return isBlank(logFile) ? null : logFile;
    }
}
