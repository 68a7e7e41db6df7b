// SPDX-License-Identifier: MIT OR Apache-2.0
package io.tzkit.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * One block as returned by {@code /chains/main/blocks/{id}}.
 *
 * <p>
 * {@code operations} is indexed by validation pass: pass 0 carries consensus
 * operations (endorsements), pass 1 governance votes, pass 2 anonymous
 * operations and pass 3 manager operations. Both the passes and the groups
 * inside each pass keep the node's order.
 *
 * <p>
 * <strong>Nullability:</strong>
 * <ul>
 * <li>{@code metadata} - can be {@code null} when the node was asked to omit it
 * or pruned it</li>
 * <li>All other fields are required</li>
 * </ul>
 *
 * @param protocol   the hash of the protocol the block was validated under
 * @param chainId    the chain identifier
 * @param hash       the block hash
 * @param header     the block header
 * @param metadata   the consensus-computed metadata
 * @param operations the operation groups, one list per validation pass
 */
public record Block(
        @JsonProperty("protocol") String protocol,
        @JsonProperty("chain_id") String chainId,
        @JsonProperty("hash") String hash,
        @JsonProperty("header") BlockHeader header,
        @JsonProperty("metadata") @Nullable BlockMetadata metadata,
        @JsonProperty("operations") List<List<OperationGroup>> operations) {

    public Block {
        Objects.requireNonNull(protocol, "protocol cannot be null");
        Objects.requireNonNull(chainId, "chainId cannot be null");
        Objects.requireNonNull(hash, "hash cannot be null");
        Objects.requireNonNull(header, "header cannot be null");
        Objects.requireNonNull(operations, "operations cannot be null");
        final List<List<OperationGroup>> passes = new ArrayList<>(operations.size());
        for (List<OperationGroup> pass : operations) {
            passes.add(List.copyOf(pass));
        }
        operations = List.copyOf(passes);
    }

    /**
     * Returns the block level from the header.
     *
     * @return the level
     */
    public long level() {
        return header.level();
    }

    /**
     * Returns every operation group of the block, passes concatenated in order.
     *
     * @return the flattened operation groups
     */
    public List<OperationGroup> allOperations() {
        final List<OperationGroup> all = new ArrayList<>();
        for (List<OperationGroup> pass : operations) {
            all.addAll(pass);
        }
        return List.copyOf(all);
    }
}
