// SPDX-License-Identifier: MIT OR Apache-2.0
package io.tzkit.core.model.operation;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonTypeName;
import com.fasterxml.jackson.databind.JsonNode;
import io.tzkit.core.types.Mutez;
import io.tzkit.core.types.Quantity;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * {@code origination}: deploys a new contract.
 *
 * <p>
 * {@code manager_pubkey} only exists before protocol 005; very old nodes
 * spell it {@code managerPubkey}. {@code script} holds the Michelson code and
 * initial storage as an opaque JSON tree.
 *
 * @param source        the originating account
 * @param fee           the fee
 * @param counter       the source counter
 * @param gasLimit      the gas limit
 * @param storageLimit  the storage limit
 * @param balance       the initial balance of the new contract
 * @param delegate      the initial delegate
 * @param managerPubkey the manager of the new contract (older protocols)
 * @param script        the contract code and storage
 * @param metadata      the execution metadata
 */
@JsonTypeName("origination")
public record Origination(
        @JsonProperty("source") String source,
        @JsonProperty("fee") Mutez fee,
        @JsonProperty("counter") Quantity counter,
        @JsonProperty("gas_limit") Quantity gasLimit,
        @JsonProperty("storage_limit") Quantity storageLimit,
        @JsonProperty("balance") Mutez balance,
        @JsonProperty("delegate") @Nullable String delegate,
        @JsonProperty("manager_pubkey") @JsonAlias("managerPubkey") @Nullable String managerPubkey,
        @JsonProperty("script") @Nullable JsonNode script,
        @JsonProperty("metadata") @Nullable ContentsMetadata metadata) implements ManagerOperation {

    public Origination {
        Objects.requireNonNull(source, "source cannot be null");
        Objects.requireNonNull(fee, "fee cannot be null");
        Objects.requireNonNull(counter, "counter cannot be null");
        Objects.requireNonNull(gasLimit, "gasLimit cannot be null");
        Objects.requireNonNull(storageLimit, "storageLimit cannot be null");
        Objects.requireNonNull(balance, "balance cannot be null");
        script = script == null || script.isNull() ? null : script.deepCopy();
    }

    @Override
    public OperationKind kind() {
        return OperationKind.ORIGINATION;
    }
}
