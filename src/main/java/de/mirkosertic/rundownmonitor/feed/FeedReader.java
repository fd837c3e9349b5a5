package de.mirkosertic.rundownmonitor.feed;

import java.io.Closeable;
import java.io.IOException;
import java.util.List;

/**
 * Read access to the server hosting the rundowns.
 * <p>
 * Implementations must tolerate being called repeatedly without an explicit disconnect in between;
 * every operation reconnects on its own if the session was lost.
 */
public interface FeedReader extends Closeable {

    void connect() throws IOException;

    /**
     * Check the session and reconnect if needed. Never throws.
     *
     * @return true if a usable session is available afterwards
     */
    boolean ensureConnected();

    void navigateTo(String path) throws IOException;

    /**
     * List the entries at the given location.
     *
     * @param path the rundown location, navigated to before listing
     * @return the entries, possibly empty
     * @throws IOException if the location cannot be listed
     */
    List<Entry> listEntries(String path) throws IOException;

    /**
     * Read the text of an entry in the location listed last.
     *
     * @param name the entry name as returned by {@link #listEntries(String)}
     * @return the entry text
     * @throws IOException if the entry cannot be read
     */
    String readEntry(String name) throws IOException;
}
