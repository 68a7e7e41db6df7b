// SPDX-License-Identifier: MIT OR Apache-2.0
package io.tzkit.core.model.operation;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.tzkit.core.model.BalanceUpdate;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Execution outcome of one operation contents.
 *
 * <p>
 * Manager operations report an {@code operation_result}; endorsements report
 * the endorsing {@code delegate} and its {@code slots}. Every kind may report
 * balance updates.
 *
 * @param balanceUpdates  the balance updates caused by the contents
 * @param operationResult the application result, for manager operations
 * @param delegate        the endorsing delegate, for endorsements
 * @param slots           the endorsement slots, for endorsements
 */
public record ContentsMetadata(
        @JsonProperty("balance_updates") @Nullable List<BalanceUpdate> balanceUpdates,
        @JsonProperty("operation_result") @Nullable OperationResult operationResult,
        @JsonProperty("delegate") @Nullable String delegate,
        @JsonProperty("slots") @Nullable List<Integer> slots) {

    public ContentsMetadata {
        balanceUpdates = balanceUpdates == null ? null : List.copyOf(balanceUpdates);
        slots = slots == null ? null : List.copyOf(slots);
    }

    /**
     * Returns the balance updates, or an empty list when none were reported.
     *
     * @return the balance updates
     */
    public List<BalanceUpdate> balanceUpdatesOrEmpty() {
        return balanceUpdates == null ? List.of() : balanceUpdates;
    }
}
