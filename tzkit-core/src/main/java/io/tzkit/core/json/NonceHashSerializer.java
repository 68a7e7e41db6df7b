// SPDX-License-Identifier: MIT OR Apache-2.0
package io.tzkit.core.json;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.tzkit.core.model.NonceHash;
import java.io.IOException;

/**
 * Writes {@link NonceHash} back in its wire form; {@link NonceHash#ABSENT} becomes {@code null}.
 *
 * <p>{@link NonceHash#MISSING} counts as empty, so properties declared with
 * {@code @JsonInclude(NON_EMPTY)} leave the key out entirely.
 */
public final class NonceHashSerializer extends StdSerializer<NonceHash> {

    public NonceHashSerializer() {
        super(NonceHash.class);
    }

    @Override
    public void serialize(final NonceHash value, final JsonGenerator gen, final SerializerProvider provider)
            throws IOException {
        if (value instanceof NonceHash.Value v) {
            gen.writeString(v.value());
        } else if (value instanceof NonceHash.Raw raw) {
            gen.writeTree(raw.node());
        } else {
            gen.writeNull();
        }
    }

    @Override
    public boolean isEmpty(final SerializerProvider provider, final NonceHash value) {
        return value == null || value instanceof NonceHash.Missing;
    }
}
