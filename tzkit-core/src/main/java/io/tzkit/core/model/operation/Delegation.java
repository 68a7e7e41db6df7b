// SPDX-License-Identifier: MIT OR Apache-2.0
package io.tzkit.core.model.operation;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonTypeName;
import io.tzkit.core.types.Mutez;
import io.tzkit.core.types.Quantity;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * {@code delegation}: sets, changes or withdraws the delegate of {@code source}.
 *
 * <p>A missing {@code delegate} withdraws the current delegation; a delegate
 * equal to the source registers it as a baker.
 *
 * @param source       the delegating account
 * @param fee          the fee
 * @param counter      the source counter
 * @param gasLimit     the gas limit
 * @param storageLimit the storage limit
 * @param delegate     the new delegate
 * @param metadata     the execution metadata
 */
@JsonTypeName("delegation")
public record Delegation(
        @JsonProperty("source") String source,
        @JsonProperty("fee") Mutez fee,
        @JsonProperty("counter") Quantity counter,
        @JsonProperty("gas_limit") Quantity gasLimit,
        @JsonProperty("storage_limit") Quantity storageLimit,
        @JsonProperty("delegate") @Nullable String delegate,
        @JsonProperty("metadata") @Nullable ContentsMetadata metadata) implements ManagerOperation {

    public Delegation {
        Objects.requireNonNull(source, "source cannot be null");
        Objects.requireNonNull(fee, "fee cannot be null");
        Objects.requireNonNull(counter, "counter cannot be null");
        Objects.requireNonNull(gasLimit, "gasLimit cannot be null");
        Objects.requireNonNull(storageLimit, "storageLimit cannot be null");
    }

    @Override
    public OperationKind kind() {
        return OperationKind.DELEGATION;
    }

    @JsonIgnore
    public boolean isWithdrawal() {
        return delegate == null;
    }

    @JsonIgnore
    public boolean isSelfDelegation() {
        return source.equals(delegate);
    }
}
