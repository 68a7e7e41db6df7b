// SPDX-License-Identifier: MIT OR Apache-2.0
package io.tzkit.rpc.internal;

import java.io.IOException;

import io.tzkit.core.InternalApi;
import io.tzkit.core.error.DecodeException;
import io.tzkit.core.error.RpcException;
import io.tzkit.core.error.TransportException;
import io.tzkit.core.error.TzkitException;
import io.tzkit.rpc.TezosProvider;

/**
 * Internal helper implementing the fetch-then-decode sequence shared by all
 * retrieval operations.
 *
 * <p>Each call:
 * <ol>
 *   <li>sends {@code GET path} through the provider; an {@link RpcException} or
 *       any other unchecked exception that is not already a tzkit error becomes
 *       a {@link TransportException} "could not get {target}" and the decoder
 *       is never invoked</li>
 *   <li>decodes the body; a failure becomes a {@link DecodeException}
 *       "could not decode {target}"</li>
 * </ol>
 * The original exception is always kept as the cause.
 *
 * <p><strong>Internal Use Only:</strong> This class is not part of the public API.
 */
@InternalApi
public final class RpcInvoker {

    /**
     * Decodes a raw response body.
     *
     * @param <T> the decoded type
     */
    @FunctionalInterface
    public interface ResponseDecoder<T> {
        /**
         * Decodes the body.
         *
         * @param body the response body
         * @return the decoded value, never {@code null}
         * @throws IOException if the body does not match the expected schema
         */
        T decode(byte[] body) throws IOException;
    }

    private final TezosProvider provider;

    public RpcInvoker(final TezosProvider provider) {
        this.provider = provider;
    }

    /**
     * Fetches {@code path} and decodes the response.
     *
     * @param path    the request path
     * @param target  what is being fetched, used in error messages (e.g. "head block")
     * @param decoder the body decoder
     * @param <T>     the result type
     * @return the decoded value
     * @throws TransportException if the provider fails
     * @throws DecodeException    if the body cannot be decoded
     */
    public <T> T call(final String path, final String target, final ResponseDecoder<T> decoder) {
        final byte[] body;
        try {
            body = provider.get(path);
        } catch (RpcException e) {
            throw new TransportException("could not get " + target, e);
        } catch (TzkitException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new TransportException("could not get " + target, e);
        }
        if (body == null) {
            throw new DecodeException("could not decode " + target + ": empty response");
        }
        try {
            return decoder.decode(body);
        } catch (IOException | IllegalArgumentException e) {
            throw new DecodeException("could not decode " + target, e);
        }
    }
}
