package com.williamcallahan.media_list_sync.exception;

/**
 * Discriminator for {@link SyncException} subtypes so callers can switch on the failure
 * category instead of inspecting exception classes.
 */
public enum ErrorKind {
    /** Required secret or credential missing or malformed */
    CONFIGURATION,
    /** Scheduler operation referenced an unregistered job name */
    JOB_NOT_FOUND,
    /** Transport-level failure reaching an upstream service */
    NETWORK,
    /** Upstream answered with a non-success HTTP status */
    HTTP_STATUS,
    /** Integration has no access token on record */
    NOT_CONNECTED,
    /** Access token is stale and cannot be refreshed without the user */
    REAUTHORIZATION_REQUIRED,
    /** Retryable failures persisted across every allowed attempt */
    RETRY_EXHAUSTED
}
