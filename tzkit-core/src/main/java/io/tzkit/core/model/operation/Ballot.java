// SPDX-License-Identifier: MIT OR Apache-2.0
package io.tzkit.core.model.operation;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonTypeName;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * {@code ballot}: a delegate votes on the proposal under exploration or promotion.
 *
 * @param source   the voting delegate
 * @param period   the voting period
 * @param proposal the protocol hash voted on
 * @param ballot   the vote
 * @param metadata the execution metadata
 */
@JsonTypeName("ballot")
public record Ballot(
        @JsonProperty("source") String source,
        @JsonProperty("period") int period,
        @JsonProperty("proposal") String proposal,
        @JsonProperty("ballot") Vote ballot,
        @JsonProperty("metadata") @Nullable ContentsMetadata metadata) implements OperationContents {

    public Ballot {
        Objects.requireNonNull(source, "source cannot be null");
        Objects.requireNonNull(proposal, "proposal cannot be null");
        Objects.requireNonNull(ballot, "ballot cannot be null");
    }

    @Override
    public OperationKind kind() {
        return OperationKind.BALLOT;
    }

    /**
     * A ballot vote.
     */
    public enum Vote {
        YAY("yay"),
        NAY("nay"),
        PASS("pass");

        private final String wireName;

        Vote(final String wireName) {
            this.wireName = wireName;
        }

        @JsonValue
        public String wireName() {
            return wireName;
        }
    }
}
