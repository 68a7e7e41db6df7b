// SPDX-License-Identifier: MIT OR Apache-2.0
package io.tzkit.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.tzkit.core.types.Mutez;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * One ledger delta produced while applying a block or an operation.
 *
 * <p>
 * {@code kind} is {@code contract} for spendable balances and {@code freezer}
 * for frozen deposits, fees and rewards. Contract updates carry
 * {@code contract}; freezer updates carry {@code category}, {@code delegate}
 * and either {@code cycle} or {@code level} depending on the protocol.
 *
 * @param kind     the balance kind
 * @param contract the affected contract, for contract updates
 * @param delegate the affected delegate, for freezer updates
 * @param change   the signed amount, in mutez
 * @param category the freezer category ({@code deposits}, {@code fees}, {@code rewards})
 * @param cycle    the cycle the frozen balance belongs to
 * @param level    the level the frozen balance belongs to (older protocols)
 * @param origin   what caused the update ({@code block}, {@code migration}, ...)
 */
public record BalanceUpdate(
        @JsonProperty("kind") String kind,
        @JsonProperty("contract") @Nullable String contract,
        @JsonProperty("delegate") @Nullable String delegate,
        @JsonProperty("change") Mutez change,
        @JsonProperty("category") @Nullable String category,
        @JsonProperty("cycle") @Nullable Integer cycle,
        @JsonProperty("level") @Nullable Integer level,
        @JsonProperty("origin") @Nullable String origin) {

    public BalanceUpdate {
        Objects.requireNonNull(kind, "kind cannot be null");
        Objects.requireNonNull(change, "change cannot be null");
    }

    @JsonIgnore
    public boolean isContract() {
        return "contract".equals(kind);
    }

    @JsonIgnore
    public boolean isFreezer() {
        return "freezer".equals(kind);
    }
}
