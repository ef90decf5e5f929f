package com.williamcallahan.media_list_sync.exception;

/**
 * Non-success HTTP response from an upstream service.
 */
public class HttpStatusException extends SyncException {

    private final int status;

    public HttpStatusException(String message, int status) {
        super(message);
        this.status = status;
    }

    public int getStatus() {
        return status;
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.HTTP_STATUS;
    }
}
