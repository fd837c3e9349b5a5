package de.mirkosertic.rundownmonitor.config;

import java.nio.file.Path;

/**
 * Settings of the local asset store and the service assets are fetched from.
 */
public record ContentSettings(
        /** Root directory holding one sub directory per asset, the state file and the index. */
        Path downloadBasePath,
        String bearerToken,
        String apiBaseUrl,
        int requestTimeoutSeconds
) {

    @Override
    public String toString() {
        return "ContentSettings[downloadBasePath=" + downloadBasePath + ", apiBaseUrl=" + apiBaseUrl
                + ", requestTimeoutSeconds=" + requestTimeoutSeconds + "]";
    }
}
