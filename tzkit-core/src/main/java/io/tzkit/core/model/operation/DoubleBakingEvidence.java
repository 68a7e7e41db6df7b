// SPDX-License-Identifier: MIT OR Apache-2.0
package io.tzkit.core.model.operation;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonTypeName;
import io.tzkit.core.model.BlockHeader;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * {@code double_baking_evidence}: two conflicting headers baked for the same level.
 *
 * @param bh1      the first header
 * @param bh2      the second header
 * @param metadata the execution metadata
 */
@JsonTypeName("double_baking_evidence")
public record DoubleBakingEvidence(
        @JsonProperty("bh1") BlockHeader bh1,
        @JsonProperty("bh2") BlockHeader bh2,
        @JsonProperty("metadata") @Nullable ContentsMetadata metadata) implements OperationContents {

    public DoubleBakingEvidence {
        Objects.requireNonNull(bh1, "bh1 cannot be null");
        Objects.requireNonNull(bh2, "bh2 cannot be null");
    }

    @Override
    public OperationKind kind() {
        return OperationKind.DOUBLE_BAKING_EVIDENCE;
    }
}
