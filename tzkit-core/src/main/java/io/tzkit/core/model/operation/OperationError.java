// SPDX-License-Identifier: MIT OR Apache-2.0
package io.tzkit.core.model.operation;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Objects;

/**
 * A node-reported operation failure.
 *
 * @param kind the error category ({@code temporary}, {@code permanent}, {@code branch})
 * @param id   the error identifier, e.g. {@code proto.005-PsBabyM1.contract.balance_too_low}
 */
public record OperationError(
        @JsonProperty("kind") String kind,
        @JsonProperty("id") String id) {

    public OperationError {
        Objects.requireNonNull(kind, "kind cannot be null");
        Objects.requireNonNull(id, "id cannot be null");
    }
}
