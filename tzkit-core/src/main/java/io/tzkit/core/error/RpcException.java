// SPDX-License-Identifier: MIT OR Apache-2.0
package io.tzkit.core.error;

/**
 * Exception thrown by a provider when a request to a Tezos node fails.
 *
 * <p>
 * Covers every transport-level problem: unreachable host, I/O errors,
 * interruption and non-success HTTP statuses. For status failures
 * {@link #statusCode()} holds the HTTP status and {@link #body()} the response
 * body the node sent (Tezos nodes usually answer with a JSON error list).
 * For failures that never produced a response the status code is
 * {@link #NO_STATUS}.
 */
public final class RpcException extends TzkitException {

    /** Status code used when no HTTP response was received. */
    public static final int NO_STATUS = -1;

    private final int statusCode;
    private final String path;
    private final String body;

    public RpcException(
            final int statusCode,
            final String message,
            final String path,
            final String body,
            final Throwable cause) {
        super(augmentMessage(message, path), cause);
        this.statusCode = statusCode;
        this.path = path;
        this.body = body;
    }

    public RpcException(final int statusCode, final String message, final String path, final String body) {
        this(statusCode, message, path, body, null);
    }

    public RpcException(final String message, final String path, final Throwable cause) {
        this(NO_STATUS, message, path, null, cause);
    }

    public int statusCode() {
        return statusCode;
    }

    public String path() {
        return path;
    }

    public String body() {
        return body;
    }

    public boolean hasStatus() {
        return statusCode != NO_STATUS;
    }

    public boolean isNotFound() {
        return statusCode == 404;
    }

    @Override
    public String toString() {
        return "RpcException{"
                + "statusCode="
                + statusCode
                + ", message="
                + getMessage()
                + ", path="
                + path
                + ", body="
                + body
                + "}";
    }

    private static String augmentMessage(final String message, final String path) {
        if (path == null || message == null || message.isBlank()) {
            return message;
        }

        return "[path=" + path + "] " + message;
    }
}
