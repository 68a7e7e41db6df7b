// SPDX-License-Identifier: MIT OR Apache-2.0
package io.tzkit.core.model.operation;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonTypeName;
import java.util.List;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * {@code proposals}: a delegate submits or upvotes protocol proposals.
 *
 * @param source    the voting delegate
 * @param period    the voting period
 * @param proposals the proposed protocol hashes
 * @param metadata  the execution metadata
 */
@JsonTypeName("proposals")
public record Proposals(
        @JsonProperty("source") String source,
        @JsonProperty("period") int period,
        @JsonProperty("proposals") List<String> proposals,
        @JsonProperty("metadata") @Nullable ContentsMetadata metadata) implements OperationContents {

    public Proposals {
        Objects.requireNonNull(source, "source cannot be null");
        Objects.requireNonNull(proposals, "proposals cannot be null");
        proposals = List.copyOf(proposals);
    }

    @Override
    public OperationKind kind() {
        return OperationKind.PROPOSALS;
    }
}
