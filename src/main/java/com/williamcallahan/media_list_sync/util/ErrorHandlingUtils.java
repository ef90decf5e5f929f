/**
 * Maps WebClient failures onto the synchronization error taxonomy
 *
 * @author William Callahan
 */

package com.williamcallahan.media_list_sync.util;

import com.williamcallahan.media_list_sync.exception.HttpStatusException;
import com.williamcallahan.media_list_sync.exception.NetworkException;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Mono;

import java.io.IOException;
import java.net.ConnectException;
import java.net.NoRouteToHostException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.util.Locale;
import java.util.concurrent.TimeoutException;

public final class ErrorHandlingUtils {

    private ErrorHandlingUtils() {
    }

    /**
     * Wrap a transport failure as a {@link NetworkException} carrying an errno-style code.
     * Throwables that are already part of the taxonomy pass through untouched.
     */
    public static Throwable toNetworkError(Throwable error, String serviceName, String baseUrl) {
        if (error instanceof HttpStatusException || error instanceof NetworkException) {
            return error;
        }
        if (error instanceof WebClientRequestException || error instanceof IOException || error instanceof TimeoutException) {
            return new NetworkException(
                    "Network error: Failed to connect to " + serviceName + " server at " + baseUrl,
                    networkCode(error),
                    error);
        }
        return error;
    }

    /**
     * Convert a non-2xx response into an {@link HttpStatusException}; the body is drained and discarded.
     */
    public static Mono<Throwable> toHttpStatusError(ClientResponse response, String serviceName) {
        int status = response.statusCode().value();
        return response.releaseBody()
                .then(Mono.<Throwable>fromSupplier(() -> new HttpStatusException(serviceName + " API error: " + status, status)));
    }

    /**
     * Best-effort errno-style code for a transport failure.
     */
    public static String networkCode(Throwable error) {
        Throwable current = error;
        while (current != null) {
            if (current instanceof ConnectException) {
                return "ECONNREFUSED";
            }
            if (current instanceof UnknownHostException) {
                return "ENOTFOUND";
            }
            if (current instanceof SocketTimeoutException || current instanceof TimeoutException) {
                return "ETIMEDOUT";
            }
            if (current instanceof NoRouteToHostException) {
                return "EHOSTUNREACH";
            }
            String message = current.getMessage();
            if (message != null && message.toLowerCase(Locale.ROOT).contains("connection reset")) {
                return "ECONNRESET";
            }
            if (current.getCause() == current) {
                break;
            }
            current = current.getCause();
        }
        return NetworkException.GENERIC_CODE;
    }
}
