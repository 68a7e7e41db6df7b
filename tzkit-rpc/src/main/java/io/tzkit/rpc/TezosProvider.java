// SPDX-License-Identifier: MIT OR Apache-2.0
package io.tzkit.rpc;

import io.tzkit.core.error.RpcException;

/**
 * Low-level abstraction for issuing read requests to a Tezos node.
 *
 * <p>
 * This interface hides the transport (URL composition, authentication,
 * connection reuse, TLS, timeouts) from the decoding layer. Implementations
 * take a path relative to the node's RPC root and return the raw response
 * body.
 *
 * <p>
 * <strong>Thread Safety:</strong> Implementations must be thread-safe if they
 * are shared between readers used from several threads.
 *
 * <p>
 * <strong>Usage:</strong> Most users should use {@link BlockReader} instead of
 * calling this directly; a lambda is enough to plug in a custom transport:
 * <pre>{@code
 * TezosProvider provider = path -> myHttpStack.fetch(path);
 * BlockReader reader = BlockReader.from(provider);
 * }</pre>
 *
 * @see HttpTezosProvider
 * @see BlockReader#from(TezosProvider)
 */
@FunctionalInterface
public interface TezosProvider extends AutoCloseable {

    /**
     * Sends a GET request.
     *
     * <p>Readers wrap any unchecked exception thrown here, not only
     * {@link RpcException}, in a {@code TransportException}.
     *
     * @param path the path relative to the RPC root, starting with {@code /}
     * @return the response body
     * @throws RpcException if the node cannot be reached or answers with a non-success status
     */
    byte[] get(String path) throws RpcException;

    /**
     * Creates a default HTTP provider.
     *
     * @param url the node RPC root, e.g. {@code https://rpc.example.org}
     * @return a new provider
     */
    static TezosProvider http(final String url) {
        return HttpTezosProvider.builder(url).build();
    }

    /**
     * Closes this provider and releases any associated resources.
     * <p>
     * The default implementation does nothing.
     */
    @Override
    default void close() {
        // Default no-op for providers that don't need cleanup
    }
}
