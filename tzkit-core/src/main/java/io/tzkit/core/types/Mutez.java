// SPDX-License-Identifier: MIT OR Apache-2.0
package io.tzkit.core.types;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * An amount of mutez (10^-6 tez), kept as the decimal text the node sent.
 * <p>
 * Tezos transmits fees, amounts, balances and balance changes as JSON strings
 * so they survive arbitrary precision. This type keeps the text verbatim and
 * only converts on request, so a decoded value re-encodes byte for byte.
 * <p>
 * Balance-update changes are signed; every other amount is non-negative, which
 * {@link #isNegative()} lets callers check.
 * <p>
 * <strong>Common Conversions:</strong>
 * <ul>
 * <li>1 tez = 1 000 000 mutez</li>
 * </ul>
 */
public record Mutez(String value) {
    private static final Pattern DECIMAL = Pattern.compile("^-?[0-9]+$");
    private static final BigDecimal MUTEZ_PER_TEZ = BigDecimal.valueOf(1_000_000L);

    public Mutez {
        Objects.requireNonNull(value, "value");
        if (!DECIMAL.matcher(value).matches()) {
            throw new IllegalArgumentException("Invalid mutez amount: " + value);
        }
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static Mutez of(final String value) {
        return new Mutez(value);
    }

    public static Mutez of(final long mutez) {
        return new Mutez(Long.toString(mutez));
    }

    public static Mutez of(final BigInteger mutez) {
        Objects.requireNonNull(mutez, "mutez");
        return new Mutez(mutez.toString());
    }

    @Override
    @JsonValue
    public String value() {
        return value;
    }

    public BigInteger toBigInteger() {
        return new BigInteger(value);
    }

    public BigDecimal toTez() {
        return new BigDecimal(toBigInteger()).divide(MUTEZ_PER_TEZ);
    }

    public boolean isNegative() {
        return value.startsWith("-");
    }

    @Override
    public String toString() {
        return value;
    }
}
