// SPDX-License-Identifier: MIT OR Apache-2.0
package io.tzkit.rpc;

import io.tzkit.core.error.DecodeException;
import io.tzkit.core.error.InvalidIdentifierException;
import io.tzkit.core.error.TransportException;
import io.tzkit.core.model.Block;
import java.util.List;

/**
 * Read-only access to the blocks of a Tezos node.
 *
 * <p>
 * Every method performs exactly one request and decodes the response: no
 * caching, no retries, no batching. Failures are reported as
 * {@link TransportException} when the node could not be reached and as
 * {@link DecodeException} when the response did not match the schema; both
 * carry the original failure as their cause and a message naming the
 * operation. The caller owns any retry policy.
 *
 * <p>
 * <strong>Usage:</strong>
 * <pre>{@code
 * BlockReader reader = BlockReader.from(TezosProvider.http("https://rpc.example.org"));
 *
 * Block head = reader.headBlock();
 * Block block = reader.getBlock(head.level() - 1);
 * List<String> hashes = reader.operationHashes(block.hash());
 * }</pre>
 *
 * <p><b>Thread Safety:</b> Implementations hold no mutable state and are
 * thread-safe whenever their {@link TezosProvider} is.
 */
public interface BlockReader {

    /**
     * Creates a reader on top of the given provider.
     *
     * @param provider the transport
     * @return a new reader
     */
    static BlockReader from(final TezosProvider provider) {
        return new DefaultBlockReader(provider);
    }

    /**
     * Fetches the current head block from {@code /chains/main/blocks/head}.
     *
     * @return the head block
     * @throws TransportException if the node could not be reached
     * @throws DecodeException    if the response is not a valid block
     */
    Block headBlock();

    /**
     * Fetches a block by identifier from {@code /chains/main/blocks/{id}}.
     *
     * @param id the block identifier
     * @return the block
     * @throws TransportException if the node could not be reached
     * @throws DecodeException    if the response is not a valid block
     */
    Block getBlock(BlockId id);

    /**
     * Fetches a block by level (integer) or hash (string).
     *
     * <p>The value is resolved through {@link BlockId#from(Object)} before any
     * request is sent.
     *
     * @param id the block level or hash
     * @return the block
     * @throws InvalidIdentifierException if {@code id} is neither an integer nor a string
     * @throws TransportException         if the node could not be reached
     * @throws DecodeException            if the response is not a valid block
     */
    Block getBlock(Object id);

    /**
     * Fetches the hashes of the operations of a block from
     * {@code /chains/main/blocks/{hash}/operation_hashes}.
     *
     * <p>The hash is used as given. The result keeps the node's order: by
     * validation pass, then by position within the pass.
     *
     * @param blockHash the block hash
     * @return the operation hashes
     * @throws TransportException if the node could not be reached
     * @throws DecodeException    if the response is not a list of hashes
     */
    List<String> operationHashes(String blockHash);
}
