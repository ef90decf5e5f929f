/**
 * Base type for failures raised by the scheduling and synchronization infrastructure
 *
 * @author William Callahan
 *
 * Features:
 * - Unchecked so reactive pipelines can propagate it through Mono.error
 * - Tagged with an {@link ErrorKind} for exhaustive handling
 */

package com.williamcallahan.media_list_sync.exception;

public abstract class SyncException extends RuntimeException {

    protected SyncException(String message) {
        super(message);
    }

    protected SyncException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract ErrorKind kind();
}
