package com.williamcallahan.media_list_sync.exception;

/**
 * Transport-level failure (connection refused, DNS, timeout) reaching an upstream service.
 * The {@code code} mirrors errno-style names such as {@code ECONNREFUSED}.
 */
public class NetworkException extends SyncException {

    public static final String GENERIC_CODE = "NETWORK_ERROR";

    private final String code;

    public NetworkException(String message, String code, Throwable cause) {
        super(message, cause);
        this.code = code == null ? GENERIC_CODE : code;
    }

    public String getCode() {
        return code;
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.NETWORK;
    }
}
