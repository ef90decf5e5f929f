package com.williamcallahan.media_list_sync.exception;

/**
 * The stored access token is stale and no refresh token is on record; the user has to
 * re-run the authorization flow.
 */
public class ReauthorizationRequiredException extends SyncException {

    private final String integration;

    public ReauthorizationRequiredException(String integration) {
        super(NotConnectedException.capitalize(integration) + " token expired and no refresh token available");
        this.integration = integration;
    }

    public String getIntegration() {
        return integration;
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.REAUTHORIZATION_REQUIRED;
    }
}
