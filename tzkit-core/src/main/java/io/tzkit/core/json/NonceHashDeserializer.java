// SPDX-License-Identifier: MIT OR Apache-2.0
package io.tzkit.core.json;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import io.tzkit.core.model.NonceHash;
import java.io.IOException;

/**
 * Reads {@code nonce_hash}: strings become {@link NonceHash.Value}, other values
 * {@link NonceHash.Raw}, {@code null} {@link NonceHash#ABSENT} and a missing key
 * {@link NonceHash#MISSING}.
 */
public final class NonceHashDeserializer extends StdDeserializer<NonceHash> {

    public NonceHashDeserializer() {
        super(NonceHash.class);
    }

    @Override
    public NonceHash deserialize(final JsonParser p, final DeserializationContext ctxt) throws IOException {
        final JsonNode node = p.readValueAsTree();
        if (node == null || node.isNull() || node.isMissingNode()) {
            return NonceHash.ABSENT;
        }
        if (node.isTextual()) {
            return new NonceHash.Value(node.textValue());
        }
        return new NonceHash.Raw(node);
    }

    @Override
    public NonceHash getNullValue(final DeserializationContext ctxt) {
        return NonceHash.ABSENT;
    }

    @Override
    public Object getAbsentValue(final DeserializationContext ctxt) {
        return NonceHash.MISSING;
    }
}
