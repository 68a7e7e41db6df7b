// SPDX-License-Identifier: MIT OR Apache-2.0
package io.tzkit.core.model.operation;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonTypeName;
import com.fasterxml.jackson.databind.JsonNode;
import io.tzkit.core.types.Mutez;
import io.tzkit.core.types.Quantity;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * {@code transaction}: transfers tez and optionally calls a contract.
 *
 * <p>
 * {@code parameters} is only present for contract calls; it holds the
 * entrypoint and the Michelson argument and is kept as an opaque JSON tree.
 *
 * @param source       the sender
 * @param fee          the fee
 * @param counter      the source counter
 * @param gasLimit     the gas limit
 * @param storageLimit the storage limit
 * @param amount       the amount transferred
 * @param destination  the receiving contract or account
 * @param parameters   the contract call parameters
 * @param metadata     the execution metadata
 */
@JsonTypeName("transaction")
public record Transaction(
        @JsonProperty("source") String source,
        @JsonProperty("fee") Mutez fee,
        @JsonProperty("counter") Quantity counter,
        @JsonProperty("gas_limit") Quantity gasLimit,
        @JsonProperty("storage_limit") Quantity storageLimit,
        @JsonProperty("amount") Mutez amount,
        @JsonProperty("destination") String destination,
        @JsonProperty("parameters") @Nullable JsonNode parameters,
        @JsonProperty("metadata") @Nullable ContentsMetadata metadata) implements ManagerOperation {

    public Transaction {
        Objects.requireNonNull(source, "source cannot be null");
        Objects.requireNonNull(fee, "fee cannot be null");
        Objects.requireNonNull(counter, "counter cannot be null");
        Objects.requireNonNull(gasLimit, "gasLimit cannot be null");
        Objects.requireNonNull(storageLimit, "storageLimit cannot be null");
        Objects.requireNonNull(amount, "amount cannot be null");
        Objects.requireNonNull(destination, "destination cannot be null");
        parameters = parameters == null || parameters.isNull() ? null : parameters.deepCopy();
    }

    @Override
    public OperationKind kind() {
        return OperationKind.TRANSACTION;
    }
}
