// SPDX-License-Identifier: MIT OR Apache-2.0
package io.tzkit.core.model.operation;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonTypeName;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * {@code double_endorsement_evidence}: two conflicting endorsements by the same delegate.
 *
 * @param op1      the first endorsement
 * @param op2      the second endorsement
 * @param slot     the denounced slot, reported by later protocols
 * @param metadata the execution metadata
 */
@JsonTypeName("double_endorsement_evidence")
public record DoubleEndorsementEvidence(
        @JsonProperty("op1") InlinedEndorsement op1,
        @JsonProperty("op2") InlinedEndorsement op2,
        @JsonProperty("slot") @Nullable Integer slot,
        @JsonProperty("metadata") @Nullable ContentsMetadata metadata) implements OperationContents {

    public DoubleEndorsementEvidence {
        Objects.requireNonNull(op1, "op1 cannot be null");
        Objects.requireNonNull(op2, "op2 cannot be null");
    }

    @Override
    public OperationKind kind() {
        return OperationKind.DOUBLE_ENDORSEMENT_EVIDENCE;
    }
}
