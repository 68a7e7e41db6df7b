// SPDX-License-Identifier: MIT OR Apache-2.0
package io.tzkit.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.tzkit.core.types.Quantity;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Consensus-computed facts about a block.
 *
 * <p>
 * Every field is optional: the genesis block, activation blocks and blocks
 * from different protocol versions report different subsets. {@code nonceHash}
 * is never {@code null}: an explicit {@code null} decodes to
 * {@link NonceHash#ABSENT} and a missing key to {@link NonceHash#MISSING}, which
 * is left out again on encoding.
 *
 * @param protocol               the protocol the block was validated under
 * @param nextProtocol           the protocol the next block will use
 * @param testChainStatus        the test chain status
 * @param maxOperationsTtl       the operation time-to-live, in blocks
 * @param maxOperationDataLength the largest accepted operation, in bytes
 * @param maxBlockHeaderLength   the largest accepted header, in bytes
 * @param maxOperationListLength the per-pass list limits
 * @param baker                  the delegate that baked the block
 * @param level                  the positional coordinates of the block
 * @param votingPeriodKind       the governance period the block belongs to
 * @param nonceHash              the seed nonce hash, see {@link NonceHash}
 * @param consumedGas            the gas consumed by the whole block
 * @param deactivated            the delegates deactivated by this block
 * @param balanceUpdates         the block-level balance updates (rewards, deposits)
 */
public record BlockMetadata(
        @JsonProperty("protocol") @Nullable String protocol,
        @JsonProperty("next_protocol") @Nullable String nextProtocol,
        @JsonProperty("test_chain_status") @Nullable TestChainStatus testChainStatus,
        @JsonProperty("max_operations_ttl") @Nullable Integer maxOperationsTtl,
        @JsonProperty("max_operation_data_length") @Nullable Integer maxOperationDataLength,
        @JsonProperty("max_block_header_length") @Nullable Integer maxBlockHeaderLength,
        @JsonProperty("max_operation_list_length") @Nullable List<MaxOperationListLength> maxOperationListLength,
        @JsonProperty("baker") @Nullable String baker,
        @JsonProperty("level") @Nullable Level level,
        @JsonProperty("voting_period_kind") @Nullable String votingPeriodKind,
        @JsonProperty("nonce_hash") @JsonInclude(JsonInclude.Include.NON_EMPTY) NonceHash nonceHash,
        @JsonProperty("consumed_gas") @Nullable Quantity consumedGas,
        @JsonProperty("deactivated") @Nullable List<String> deactivated,
        @JsonProperty("balance_updates") @Nullable List<BalanceUpdate> balanceUpdates) {

    public BlockMetadata {
        nonceHash = nonceHash == null ? NonceHash.MISSING : nonceHash;
        maxOperationListLength = maxOperationListLength == null ? null : List.copyOf(maxOperationListLength);
        deactivated = deactivated == null ? null : List.copyOf(deactivated);
        balanceUpdates = balanceUpdates == null ? null : List.copyOf(balanceUpdates);
    }
}
