// SPDX-License-Identifier: MIT OR Apache-2.0
package io.tzkit.core.model.operation;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Application status of a manager operation.
 */
public enum OperationStatus {
    /** The operation was applied. */
    APPLIED("applied"),
    /** The operation failed; its errors are reported. */
    FAILED("failed"),
    /** The operation was applied, then reverted because a later one in the group failed. */
    BACKTRACKED("backtracked"),
    /** The operation was not attempted because an earlier one in the group failed. */
    SKIPPED("skipped");

    private final String wireName;

    OperationStatus(final String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public boolean isApplied() {
        return this == APPLIED;
    }
}
