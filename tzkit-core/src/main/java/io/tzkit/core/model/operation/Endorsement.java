// SPDX-License-Identifier: MIT OR Apache-2.0
package io.tzkit.core.model.operation;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonTypeName;
import org.jspecify.annotations.Nullable;

/**
 * {@code endorsement}: a baker attests the block at {@code level}.
 *
 * @param level    the endorsed level
 * @param metadata the execution metadata
 */
@JsonTypeName("endorsement")
public record Endorsement(
        @JsonProperty("level") long level,
        @JsonProperty("metadata") @Nullable ContentsMetadata metadata) implements OperationContents {

    @Override
    public OperationKind kind() {
        return OperationKind.ENDORSEMENT;
    }
}
