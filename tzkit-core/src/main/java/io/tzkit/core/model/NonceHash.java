// SPDX-License-Identifier: MIT OR Apache-2.0
package io.tzkit.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import io.tzkit.core.json.NonceHashDeserializer;
import io.tzkit.core.json.NonceHashSerializer;
import java.util.Objects;
import java.util.Optional;

/**
 * The {@code nonce_hash} field of block metadata.
 * <p>
 * Nodes report {@code null} for blocks that do not commit to a seed nonce and
 * a nonce hash string for those that do, but the schema leaves the field
 * unconstrained. Instead of an untyped passthrough the possible states are
 * explicit:
 * <ul>
 * <li>{@link #ABSENT} - {@code null} on the wire</li>
 * <li>{@link #MISSING} - no {@code nonce_hash} key at all; re-encoding omits it again</li>
 * <li>{@link Value} - a nonce hash string</li>
 * <li>{@link Raw} - any other JSON value, preserved verbatim</li>
 * </ul>
 * <p>
 * <strong>Usage:</strong>
 * <pre>{@code
 * NonceHash nonce = block.metadata().nonceHash();
 * if (nonce instanceof NonceHash.Value v) {
 *     String hash = v.hash();
 * }
 * }</pre>
 */
@JsonSerialize(using = NonceHashSerializer.class)
@JsonDeserialize(using = NonceHashDeserializer.class)
public sealed interface NonceHash permits NonceHash.Absent, NonceHash.Missing, NonceHash.Value, NonceHash.Raw {

    /** The node reported {@code null}. */
    NonceHash ABSENT = new Absent();

    /** The node did not send the field. */
    NonceHash MISSING = new Missing();

    /**
     * Creates a known-shape nonce hash.
     *
     * @param hash the nonce hash
     * @return the nonce hash value
     */
    static NonceHash of(String hash) {
        return new Value(hash);
    }

    /**
     * Returns the nonce hash string, if this is a known-shape value.
     *
     * @return the hash, or empty for {@link #ABSENT}, {@link #MISSING} and {@link Raw}
     */
    default Optional<String> hash() {
        return Optional.empty();
    }

    /**
     * Returns {@code true} unless this is {@link #ABSENT} or {@link #MISSING}.
     *
     * @return whether the node reported anything
     */
    default boolean isPresent() {
        return true;
    }

    /**
     * Nothing reported.
     */
    record Absent() implements NonceHash {
        @Override
        public boolean isPresent() {
            return false;
        }
    }

    /**
     * Field not sent.
     */
    record Missing() implements NonceHash {
        @Override
        public boolean isPresent() {
            return false;
        }
    }

    /**
     * A nonce hash string.
     */
    record Value(String value) implements NonceHash {
        public Value {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public Optional<String> hash() {
            return Optional.of(value);
        }
    }

    /**
     * A JSON value of unexpected shape, kept as received.
     */
    record Raw(JsonNode node) implements NonceHash {
        public Raw {
            Objects.requireNonNull(node, "node");
            if (node.isNull() || node.isMissingNode()) {
                throw new IllegalArgumentException("Raw nonce hash cannot be null; use NonceHash.ABSENT");
            }
            node = node.deepCopy();
        }

        @Override
        public JsonNode node() {
            return node.deepCopy();
        }
    }
}
