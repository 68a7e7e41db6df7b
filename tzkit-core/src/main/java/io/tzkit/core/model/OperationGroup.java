// SPDX-License-Identifier: MIT OR Apache-2.0
package io.tzkit.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.tzkit.core.model.operation.OperationContents;
import java.util.List;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * One signed operation envelope included in a block.
 *
 * <p>
 * A group bundles one or more contents sharing a branch and a signature, for
 * example a reveal followed by a transaction from the same source. The order
 * of {@code contents} is the order the node applied them in.
 *
 * @param protocol  the protocol hash
 * @param chainId   the chain identifier
 * @param hash      the operation hash
 * @param branch    the block hash the operation was forged against
 * @param contents  the operation contents, in application order
 * @param signature the signature, absent for unsigned anonymous operations
 */
public record OperationGroup(
        @JsonProperty("protocol") String protocol,
        @JsonProperty("chain_id") String chainId,
        @JsonProperty("hash") String hash,
        @JsonProperty("branch") String branch,
        @JsonProperty("contents") List<OperationContents> contents,
        @JsonProperty("signature") @Nullable String signature) {

    public OperationGroup {
        Objects.requireNonNull(protocol, "protocol cannot be null");
        Objects.requireNonNull(chainId, "chainId cannot be null");
        Objects.requireNonNull(hash, "hash cannot be null");
        Objects.requireNonNull(branch, "branch cannot be null");
        Objects.requireNonNull(contents, "contents cannot be null");
        contents = List.copyOf(contents);
    }
}
