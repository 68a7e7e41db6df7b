// SPDX-License-Identifier: MIT OR Apache-2.0
package io.tzkit.core.model.operation;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonTypeName;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * {@code endorsement_with_slot}: an endorsement wrapped together with the slot it was produced for.
 *
 * @param endorsement the wrapped, signed endorsement
 * @param slot        the endorsing slot
 * @param metadata    the execution metadata
 */
@JsonTypeName("endorsement_with_slot")
public record EndorsementWithSlot(
        @JsonProperty("endorsement") InlinedEndorsement endorsement,
        @JsonProperty("slot") int slot,
        @JsonProperty("metadata") @Nullable ContentsMetadata metadata) implements OperationContents {

    public EndorsementWithSlot {
        Objects.requireNonNull(endorsement, "endorsement cannot be null");
    }

    @Override
    public OperationKind kind() {
        return OperationKind.ENDORSEMENT_WITH_SLOT;
    }
}
