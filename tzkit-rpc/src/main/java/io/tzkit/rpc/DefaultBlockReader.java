// SPDX-License-Identifier: MIT OR Apache-2.0
package io.tzkit.rpc;

import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.tzkit.core.DebugLogger;
import io.tzkit.core.LogFormatter;
import io.tzkit.core.error.InvalidIdentifierException;
import io.tzkit.core.json.TezosJson;
import io.tzkit.core.model.Block;
import io.tzkit.rpc.internal.RpcInvoker;
import io.tzkit.rpc.internal.RpcPaths;

/**
 * Default implementation of {@link BlockReader}.
 *
 * <p>Holds nothing but the provider; every call is an independent
 * request-and-decode sequence.
 */
final class DefaultBlockReader implements BlockReader {

    private static final Logger log = LoggerFactory.getLogger(DefaultBlockReader.class);

    private final RpcInvoker rpc;

    /**
     * Creates a reader using the given provider.
     *
     * @param provider the transport
     */
    DefaultBlockReader(final TezosProvider provider) {
        this.rpc = new RpcInvoker(Objects.requireNonNull(provider, "provider"));
    }

    @Override
    public Block headBlock() {
        log.debug("Fetching head block");
        return decodeLogged(rpc.call(RpcPaths.HEAD_BLOCK, "head block", TezosJson::readBlock));
    }

    @Override
    public Block getBlock(final BlockId id) {
        if (id == null) {
            throw new InvalidIdentifierException("could not get block: id cannot be null");
        }
        final String segment = id.toPathSegment();
        log.debug("Fetching block {}", segment);
        return decodeLogged(rpc.call(RpcPaths.block(segment), "block '" + segment + "'", TezosJson::readBlock));
    }

    @Override
    public Block getBlock(final Object id) {
        final BlockId blockId;
        try {
            blockId = BlockId.from(id);
        } catch (InvalidIdentifierException e) {
            throw new InvalidIdentifierException("could not get block: " + e.getMessage(), e);
        }
        return getBlock(blockId);
    }

    @Override
    public List<String> operationHashes(final String blockHash) {
        Objects.requireNonNull(blockHash, "blockHash");
        log.debug("Fetching operation hashes of block {}", blockHash);
        return rpc.call(
                RpcPaths.operationHashes(blockHash),
                "operation hashes of block '" + blockHash + "'",
                TezosJson::readOperationHashes);
    }

    private static Block decodeLogged(final Block block) {
        DebugLogger.logDecode(LogFormatter.formatDecode(block.hash(), block.level(), block.operations().size()));
        return block;
    }
}
