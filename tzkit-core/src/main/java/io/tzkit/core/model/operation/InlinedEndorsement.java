// SPDX-License-Identifier: MIT OR Apache-2.0
package io.tzkit.core.model.operation;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Objects;

/**
 * A signed endorsement embedded in another operation.
 *
 * <p>Appears in {@code endorsement_with_slot} and as both halves of
 * {@code double_endorsement_evidence}.
 *
 * @param branch     the block the endorsement was forged against
 * @param operations the endorsement itself
 * @param signature  the endorser's signature
 */
public record InlinedEndorsement(
        @JsonProperty("branch") String branch,
        @JsonProperty("operations") Endorsement operations,
        @JsonProperty("signature") String signature) {

    public InlinedEndorsement {
        Objects.requireNonNull(branch, "branch cannot be null");
        Objects.requireNonNull(operations, "operations cannot be null");
        Objects.requireNonNull(signature, "signature cannot be null");
    }
}
