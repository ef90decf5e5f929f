package com.williamcallahan.media_list_sync.exception;

/**
 * Raised at startup or first use when required secrets or client credentials are absent or malformed.
 */
public class ConfigurationException extends SyncException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.CONFIGURATION;
    }
}
