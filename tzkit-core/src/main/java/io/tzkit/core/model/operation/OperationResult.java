// SPDX-License-Identifier: MIT OR Apache-2.0
package io.tzkit.core.model.operation;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.tzkit.core.types.Quantity;
import java.util.List;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * Result of applying a manager operation.
 *
 * <p>
 * {@code errors} is only reported for failed operations;
 * {@code originatedContracts} only for originations. Storage figures are
 * reported by transactions and originations that touch storage.
 *
 * @param status              the application status
 * @param consumedGas         the gas consumed
 * @param errors              the errors, in the order the node reported them
 * @param storageSize         the resulting storage size, in bytes
 * @param paidStorageSizeDiff the storage bytes paid for
 * @param originatedContracts the contracts created by an origination
 */
public record OperationResult(
        @JsonProperty("status") OperationStatus status,
        @JsonProperty("consumed_gas") @Nullable Quantity consumedGas,
        @JsonProperty("errors") @Nullable List<OperationError> errors,
        @JsonProperty("storage_size") @Nullable Quantity storageSize,
        @JsonProperty("paid_storage_size_diff") @Nullable Quantity paidStorageSizeDiff,
        @JsonProperty("originated_contracts") @Nullable List<String> originatedContracts) {

    public OperationResult {
        Objects.requireNonNull(status, "status cannot be null");
        errors = errors == null ? null : List.copyOf(errors);
        originatedContracts = originatedContracts == null ? null : List.copyOf(originatedContracts);
    }
}
