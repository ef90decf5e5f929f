package com.williamcallahan.media_list_sync.exception;

/**
 * Wraps the last failure observed once every allowed attempt has been spent on retryable errors.
 * Non-retryable failures are never wrapped, which is how callers tell the two apart.
 */
public class RetryExhaustedException extends SyncException {

    private final long attempts;

    public RetryExhaustedException(String operation, long attempts, Throwable lastFailure) {
        super("Retries exhausted for " + operation + " after " + attempts + " attempt(s): "
                + (lastFailure == null ? "unknown error" : lastFailure.getMessage()), lastFailure);
        this.attempts = attempts;
    }

    public long getAttempts() {
        return attempts;
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.RETRY_EXHAUSTED;
    }
}
