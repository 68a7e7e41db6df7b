// SPDX-License-Identifier: MIT OR Apache-2.0
package io.tzkit.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.jspecify.annotations.Nullable;

/**
 * Position of a block level within the cycle and voting-period structure.
 *
 * @param level                the block level
 * @param levelPosition        the level counted from the first level of the protocol family
 * @param cycle                the cycle containing the level
 * @param cyclePosition        the offset of the level inside its cycle
 * @param votingPeriod         the voting period containing the level
 * @param votingPeriodPosition the offset of the level inside its voting period
 * @param expectedCommitment   whether a seed nonce commitment is expected at this level
 */
public record Level(
        @JsonProperty("level") @Nullable Long level,
        @JsonProperty("level_position") @Nullable Long levelPosition,
        @JsonProperty("cycle") @Nullable Integer cycle,
        @JsonProperty("cycle_position") @Nullable Integer cyclePosition,
        @JsonProperty("voting_period") @Nullable Integer votingPeriod,
        @JsonProperty("voting_period_position") @Nullable Integer votingPeriodPosition,
        @JsonProperty("expected_commitment") @Nullable Boolean expectedCommitment) {}
