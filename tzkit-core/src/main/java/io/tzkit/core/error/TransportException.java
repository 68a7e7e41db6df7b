// SPDX-License-Identifier: MIT OR Apache-2.0
package io.tzkit.core.error;

import org.jspecify.annotations.Nullable;

/**
 * Thrown when a retrieval operation could not obtain a response from the node.
 *
 * <p>
 * The message names the operation that failed (for example
 * {@code "could not get head block"}). The cause is the provider's
 * {@link RpcException}, or whatever unchecked exception a custom provider
 * threw instead.
 */
public final class TransportException extends TzkitException {

    public TransportException(final String message, final Throwable cause) {
        super(message, cause);
    }

    /**
     * Returns the underlying provider failure.
     *
     * @return the wrapped RPC exception, or {@code null} if the provider failed
     *         with some other exception
     */
    public @Nullable RpcException rpcCause() {
        return getCause() instanceof RpcException rpc ? rpc : null;
    }
}
