// SPDX-License-Identifier: MIT OR Apache-2.0
package io.tzkit.core.model.operation;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonTypeName;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * {@code seed_nonce_revelation}: reveals the nonce committed to at {@code level}.
 *
 * @param level    the level of the block holding the commitment
 * @param nonce    the revealed nonce
 * @param metadata the execution metadata
 */
@JsonTypeName("seed_nonce_revelation")
public record SeedNonceRevelation(
        @JsonProperty("level") long level,
        @JsonProperty("nonce") String nonce,
        @JsonProperty("metadata") @Nullable ContentsMetadata metadata) implements OperationContents {

    public SeedNonceRevelation {
        Objects.requireNonNull(nonce, "nonce cannot be null");
    }

    @Override
    public OperationKind kind() {
        return OperationKind.SEED_NONCE_REVELATION;
    }
}
