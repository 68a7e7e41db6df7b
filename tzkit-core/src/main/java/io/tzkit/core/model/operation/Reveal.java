// SPDX-License-Identifier: MIT OR Apache-2.0
package io.tzkit.core.model.operation;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonTypeName;
import io.tzkit.core.types.Mutez;
import io.tzkit.core.types.Quantity;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * {@code reveal}: publishes the public key of an implicit account.
 *
 * @param source       the revealing account
 * @param fee          the fee
 * @param counter      the source counter
 * @param gasLimit     the gas limit
 * @param storageLimit the storage limit
 * @param publicKey    the revealed public key
 * @param metadata     the execution metadata
 */
@JsonTypeName("reveal")
public record Reveal(
        @JsonProperty("source") String source,
        @JsonProperty("fee") Mutez fee,
        @JsonProperty("counter") Quantity counter,
        @JsonProperty("gas_limit") Quantity gasLimit,
        @JsonProperty("storage_limit") Quantity storageLimit,
        @JsonProperty("public_key") String publicKey,
        @JsonProperty("metadata") @Nullable ContentsMetadata metadata) implements ManagerOperation {

    public Reveal {
        Objects.requireNonNull(source, "source cannot be null");
        Objects.requireNonNull(fee, "fee cannot be null");
        Objects.requireNonNull(counter, "counter cannot be null");
        Objects.requireNonNull(gasLimit, "gasLimit cannot be null");
        Objects.requireNonNull(storageLimit, "storageLimit cannot be null");
        Objects.requireNonNull(publicKey, "publicKey cannot be null");
    }

    @Override
    public OperationKind kind() {
        return OperationKind.REVEAL;
    }
}
