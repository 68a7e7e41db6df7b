// SPDX-License-Identifier: MIT OR Apache-2.0
package io.tzkit.core.types;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.math.BigInteger;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * A non-negative integer counter or resource figure transmitted as decimal text.
 * <p>
 * Used for operation counters, gas and storage limits, consumed gas and
 * storage sizes. The text is kept verbatim; {@link #toBigInteger()} gives an
 * arbitrary-precision view.
 */
public record Quantity(String value) {
    private static final Pattern DECIMAL = Pattern.compile("^[0-9]+$");

    public Quantity {
        Objects.requireNonNull(value, "value");
        if (!DECIMAL.matcher(value).matches()) {
            throw new IllegalArgumentException("Invalid quantity: " + value);
        }
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static Quantity of(final String value) {
        return new Quantity(value);
    }

    public static Quantity of(final long value) {
        if (value < 0) {
            throw new IllegalArgumentException("Quantity cannot be negative: " + value);
        }
        return new Quantity(Long.toString(value));
    }

    @Override
    @JsonValue
    public String value() {
        return value;
    }

    public BigInteger toBigInteger() {
        return new BigInteger(value);
    }

    @Override
    public String toString() {
        return value;
    }
}
