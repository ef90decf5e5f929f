package com.williamcallahan.media_list_sync.exception;

public class NotConnectedException extends SyncException {

    private final String integration;

    public NotConnectedException(String integration) {
        super(capitalize(integration) + " not connected");
        this.integration = integration;
    }

    public String getIntegration() {
        return integration;
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.NOT_CONNECTED;
    }

    static String capitalize(String value) {
        if (value == null || value.isEmpty()) {
            return "Integration";
        }
        return Character.toUpperCase(value.charAt(0)) + value.substring(1);
    }
}
