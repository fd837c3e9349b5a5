package de.mirkosertic.rundownmonitor.config;

/**
 * Connection settings of the rundown server.
 */
public record ServerSettings(
        String host,
        int port,
        String user,
        String password,
        int timeoutSeconds,
        String encoding
) {

    @Override
    public String toString() {
        return "ServerSettings[host=" + host + ", port=" + port + ", user=" + user
                + ", timeoutSeconds=" + timeoutSeconds + ", encoding=" + encoding + "]";
    }
}
