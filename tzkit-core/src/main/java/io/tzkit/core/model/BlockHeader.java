// SPDX-License-Identifier: MIT OR Apache-2.0
package io.tzkit.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * Represents a block header.
 *
 * <p>
 * The same shape appears inside double-baking evidence, so this record is
 * also used for the two conflicting headers of that operation.
 *
 * <p>
 * {@code priority} and {@code proof_of_work_nonce} disappeared or moved between
 * protocol versions and are therefore nullable. {@code seed_nonce_hash} is
 * only present on blocks that commit to a seed nonce.
 *
 * @param level          the block level (height)
 * @param proto          the number of protocol changes since genesis
 * @param predecessor    the hash of the previous block
 * @param timestamp      the RFC 3339 timestamp, as sent by the node
 * @param validationPass the number of validation passes
 * @param operationsHash the hash of the operation list
 * @param fitness        the fitness vector, ordered, opaque
 * @param context        the hash of the resulting context
 * @param priority       the baking priority
 * @param proofOfWorkNonce the proof-of-work nonce
 * @param seedNonceHash  the seed nonce commitment
 * @param signature      the baker's signature
 */
public record BlockHeader(
        @JsonProperty("level") long level,
        @JsonProperty("proto") int proto,
        @JsonProperty("predecessor") String predecessor,
        @JsonProperty("timestamp") String timestamp,
        @JsonProperty("validation_pass") int validationPass,
        @JsonProperty("operations_hash") String operationsHash,
        @JsonProperty("fitness") List<String> fitness,
        @JsonProperty("context") String context,
        @JsonProperty("priority") @Nullable Integer priority,
        @JsonProperty("proof_of_work_nonce") @Nullable String proofOfWorkNonce,
        @JsonProperty("seed_nonce_hash") @Nullable String seedNonceHash,
        @JsonProperty("signature") String signature) {

    public BlockHeader {
        Objects.requireNonNull(predecessor, "predecessor cannot be null");
        Objects.requireNonNull(timestamp, "timestamp cannot be null");
        Objects.requireNonNull(operationsHash, "operationsHash cannot be null");
        Objects.requireNonNull(fitness, "fitness cannot be null");
        Objects.requireNonNull(context, "context cannot be null");
        Objects.requireNonNull(signature, "signature cannot be null");
        fitness = List.copyOf(fitness);
    }

    /**
     * Parses the header timestamp.
     *
     * @return the timestamp as an instant
     * @throws java.time.format.DateTimeParseException if the node sent a malformed timestamp
     */
    public Instant instant() {
        return Instant.parse(timestamp);
    }
}
