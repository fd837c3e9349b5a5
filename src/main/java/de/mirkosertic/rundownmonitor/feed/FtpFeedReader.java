package de.mirkosertic.rundownmonitor.feed;

import de.mirkosertic.rundownmonitor.config.ServerSettings;
import org.apache.commons.net.ftp.FTPClient;
import org.apache.commons.net.ftp.FTPClientConfig;
import org.apache.commons.net.ftp.FTPFile;
import org.apache.commons.net.ftp.FTPReply;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.Charset;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * {@link FeedReader} for newsroom systems that expose their rundowns over FTP.
 * <p>
 * Rundowns are plain FTP directories and entries are text files. Newsroom servers often answer
 * {@code LIST} in a format the standard parsers do not recognise, so unparseable lines are kept and
 * interpreted with {@link #parseListingLine(String)}.
 */
public class FtpFeedReader implements FeedReader {

    private static final Logger logger = LoggerFactory.getLogger(FtpFeedReader.class);

    private final ServerSettings settings;
    private final Supplier<FTPClient> clientFactory;
    private final Charset charset;

    private @Nullable FTPClient client;

    public FtpFeedReader(final ServerSettings settings) {
        this(settings, FTPClient::new);
    }

    FtpFeedReader(final ServerSettings settings, final Supplier<FTPClient> clientFactory) {
        this.settings = settings;
        this.clientFactory = clientFactory;
        this.charset = Charset.forName(settings.encoding());
    }

    @Override
    public synchronized void connect() throws IOException {
        logger.info("Connecting to {}:{}...", settings.host(), settings.port());
        final FTPClient ftp = clientFactory.get();
        final Duration timeout = Duration.ofSeconds(settings.timeoutSeconds());
        ftp.setConnectTimeout((int) timeout.toMillis());
        ftp.setDefaultTimeout((int) timeout.toMillis());
        ftp.setControlEncoding(settings.encoding());

        final FTPClientConfig clientConfig = new FTPClientConfig(FTPClientConfig.SYST_UNIX);
        clientConfig.setUnparseableEntries(true);
        ftp.configure(clientConfig);

        try {
            ftp.connect(settings.host(), settings.port());
            if (!FTPReply.isPositiveCompletion(ftp.getReplyCode())) {
                throw new IOException("Server refused connection: " + ftp.getReplyString());
            }
            if (!ftp.login(settings.user(), settings.password())) {
                throw new IOException("Login failed for user " + settings.user() + ": " + ftp.getReplyString());
            }
            ftp.enterLocalPassiveMode();
            ftp.setSoTimeout((int) timeout.toMillis());

            // Not every server supports it; the configured control encoding is used either way
            if (!ftp.sendSiteCommand("CHARSET UTF-8")) {
                logger.debug("Server rejected SITE CHARSET: {}", ftp.getReplyString());
            }
        } catch (final IOException e) {
            disconnectQuietly(ftp);
            throw e;
        }

        this.client = ftp;
        logger.info("Connected to {}", settings.host());
    }

    @Override
    public synchronized boolean ensureConnected() {
        if (isConnected()) {
            return true;
        }
        close();
        try {
            connect();
            return true;
        } catch (final IOException e) {
            logger.error("Connection to {} failed", settings.host(), e);
            return false;
        }
    }

    private boolean isConnected() {
        final FTPClient ftp = client;
        if (ftp == null || !ftp.isConnected()) {
            return false;
        }
        try {
            return ftp.sendNoOp();
        } catch (final IOException e) {
            logger.debug("NOOP failed, session is gone: {}", e.getMessage());
            return false;
        }
    }

    /**
     * Navigate from the root folder by folder. Both {@code /} and {@code \} separate folders.
     */
    @Override
    public synchronized void navigateTo(final String path) throws IOException {
        final FTPClient ftp = requireConnection();
        if (!ftp.changeWorkingDirectory("/")) {
            throw new IOException("Cannot change to root folder: " + ftp.getReplyString());
        }
        for (final String folder : path.replace('\\', '/').split("/")) {
            if (folder.isEmpty()) {
                continue;
            }
            if (!ftp.changeWorkingDirectory(folder)) {
                throw new IOException("Cannot navigate to " + path + " (failed at " + folder + "): "
                        + ftp.getReplyString());
            }
        }
        logger.debug("Navigated to {}", path);
    }

    @Override
    public synchronized List<Entry> listEntries(final String path) throws IOException {
        navigateTo(path);
        final FTPFile[] files = requireConnection().listFiles();
        final List<Entry> entries = new ArrayList<>();
        if (files == null) {
            return entries;
        }
        for (final FTPFile file : files) {
            if (file == null) {
                continue;
            }
            if (file.isValid()) {
                entries.add(new Entry(file.getName(), file.isDirectory()));
            } else {
                parseListingLine(file.getRawListing()).ifPresent(entries::add);
            }
        }
        return entries;
    }

    @Override
    public synchronized String readEntry(final String name) throws IOException {
        final FTPClient ftp = requireConnection();
        final InputStream stream = ftp.retrieveFileStream(name);
        if (stream == null) {
            throw new IOException("Cannot read " + name + ": " + ftp.getReplyString());
        }
        final byte[] data;
        try (stream) {
            data = stream.readAllBytes();
        } catch (final IOException e) {
            discardTransfer(ftp, name);
            throw e;
        }
        if (!ftp.completePendingCommand()) {
            throw new IOException("Transfer of " + name + " did not complete: " + ftp.getReplyString());
        }
        return new String(data, charset).lines().collect(Collectors.joining("\n"));
    }

    /**
     * Consume the final reply of a broken transfer so the control channel stays in step. If that
     * fails too the session is closed and the next call reconnects.
     */
    private void discardTransfer(final FTPClient ftp, final String name) {
        try {
            if (!ftp.completePendingCommand()) {
                logger.debug("Transfer of {} aborted: {}", name, ftp.getReplyString());
            }
        } catch (final IOException e) {
            logger.warn("Control connection out of sync after failed transfer of {}, reconnecting", name, e);
            close();
        }
    }

    private FTPClient requireConnection() throws IOException {
        if (!ensureConnected()) {
            throw new IOException("Not connected to " + settings.host());
        }
        final FTPClient ftp = client;
        if (ftp == null) {
            throw new IOException("Not connected to " + settings.host());
        }
        return ftp;
    }

    @Override
    public synchronized void close() {
        final FTPClient ftp = client;
        client = null;
        if (ftp != null) {
            disconnectQuietly(ftp);
            logger.info("Disconnected from {}", settings.host());
        }
    }

    private static void disconnectQuietly(final FTPClient ftp) {
        try {
            if (ftp.isConnected()) {
                ftp.logout();
            }
        } catch (final IOException e) {
            logger.debug("Logout failed: {}", e.getMessage());
        }
        try {
            if (ftp.isConnected()) {
                ftp.disconnect();
            }
        } catch (final IOException e) {
            logger.debug("Disconnect failed: {}", e.getMessage());
        }
    }

    /**
     * Interpret a raw {@code LIST} line.
     * <p>
     * Unix style lines ({@code drwxr-xr-x 1 user group size month day time name}) yield the name from
     * the ninth column on, which may contain spaces. Shorter lines yield their last token.
     * A leading {@code d} marks a directory.
     *
     * @param line the raw listing line (may be null)
     * @return the entry, or empty for blank lines
     */
    static Optional<Entry> parseListingLine(final @Nullable String line) {
        if (line == null || line.isBlank()) {
            return Optional.empty();
        }
        final String[] parts = line.trim().split("\\s+");
        if (parts.length < 9) {
            return Optional.of(new Entry(parts[parts.length - 1], line.startsWith("d")));
        }
        final String name = String.join(" ", Arrays.copyOfRange(parts, 8, parts.length));
        return Optional.of(new Entry(name, parts[0].startsWith("d")));
    }
}
