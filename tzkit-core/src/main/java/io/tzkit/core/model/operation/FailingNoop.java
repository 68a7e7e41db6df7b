// SPDX-License-Identifier: MIT OR Apache-2.0
package io.tzkit.core.model.operation;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonTypeName;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * {@code failing_noop}: signs arbitrary bytes that can never be included in a valid block.
 *
 * <p>Never carries metadata.
 *
 * @param arbitrary the signed payload, hex encoded
 */
@JsonTypeName("failing_noop")
public record FailingNoop(@JsonProperty("arbitrary") String arbitrary) implements OperationContents {

    public FailingNoop {
        Objects.requireNonNull(arbitrary, "arbitrary cannot be null");
    }

    @Override
    public OperationKind kind() {
        return OperationKind.FAILING_NOOP;
    }

    @Override
    public @Nullable ContentsMetadata metadata() {
        return null;
    }
}
