// SPDX-License-Identifier: MIT OR Apache-2.0
package io.tzkit.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.jspecify.annotations.Nullable;

/**
 * Size limits of one validation pass.
 *
 * @param maxSize the maximum total size, in bytes
 * @param maxOp   the maximum number of operations, absent when unlimited
 */
public record MaxOperationListLength(
        @JsonProperty("max_size") int maxSize,
        @JsonProperty("max_op") @Nullable Integer maxOp) {}
