// SPDX-License-Identifier: MIT OR Apache-2.0
package io.tzkit.rpc;

import io.tzkit.core.error.InvalidIdentifierException;
import java.math.BigInteger;
import java.util.Objects;

/**
 * Identifies a block by level or by hash.
 * <p>
 * Both forms address the same RPC path, {@code /chains/main/blocks/{id}}; this
 * type normalizes either one into the path segment.
 * <p>
 * <strong>Usage:</strong>
 * <pre>{@code
 * BlockId byLevel = BlockId.level(523L);
 * BlockId byHash = BlockId.hash("BLockGenesisGenesisGenesisGenesisGenesisf79b5d1CoW2");
 *
 * // From a value whose kind is only known at runtime (config, CLI, JSON)
 * BlockId id = BlockId.from(value);
 *
 * String segment = byLevel.toPathSegment(); // "523"
 * }</pre>
 */
public sealed interface BlockId permits BlockId.Level, BlockId.Hash {

    /**
     * Creates a block identifier for a specific level.
     *
     * @param level the block level
     * @return a BlockId addressing the block at {@code level}
     */
    static BlockId level(long level) {
        return new Level(BigInteger.valueOf(level));
    }

    /**
     * Creates a block identifier for a specific hash.
     *
     * @param hash the block hash
     * @return a BlockId addressing the block with {@code hash}
     * @throws InvalidIdentifierException if the hash is {@code null}
     */
    static BlockId hash(String hash) {
        return new Hash(hash);
    }

    /**
     * Resolves a value whose kind is only known at runtime.
     * <p>
     * Integers ({@link Byte}, {@link Short}, {@link Integer}, {@link Long},
     * {@link BigInteger}) address a level and strings a hash. Anything else,
     * floating point and booleans included, is rejected rather than coerced.
     *
     * @param id the level or hash
     * @return the block identifier
     * @throws InvalidIdentifierException if {@code id} is neither an integer nor a string
     */
    static BlockId from(Object id) {
        if (id instanceof BlockId blockId) {
            return blockId;
        }
        if (id instanceof String hash) {
            return new Hash(hash);
        }
        if (id instanceof BigInteger level) {
            return new Level(level);
        }
        if (id instanceof Long || id instanceof Integer || id instanceof Short || id instanceof Byte) {
            return new Level(BigInteger.valueOf(((Number) id).longValue()));
        }
        throw new InvalidIdentifierException(
                "id must be a block level (integer) or a block hash (string), got "
                        + (id == null ? "null" : id.getClass().getSimpleName()));
    }

    /**
     * Converts this identifier to its RPC path segment.
     * <p>
     * Levels render as decimal text and hashes unchanged. Hash text is not
     * validated; the node answers unknown or malformed hashes with an error.
     *
     * @return the path segment
     */
    String toPathSegment();

    /**
     * Block level.
     */
    record Level(BigInteger level) implements BlockId {
        public Level {
            Objects.requireNonNull(level, "level");
        }

        @Override
        public String toPathSegment() {
            return level.toString();
        }
    }

    /**
     * Block hash.
     */
    record Hash(String hash) implements BlockId {
        public Hash {
            if (hash == null) {
                throw new InvalidIdentifierException("Block hash cannot be null");
            }
        }

        @Override
        public String toPathSegment() {
            return hash;
        }
    }
}
