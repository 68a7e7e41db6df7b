// SPDX-License-Identifier: MIT OR Apache-2.0
package io.tzkit.core.model.operation;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonTypeName;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * {@code activate_account}: activates a fundraiser account.
 *
 * @param pkh      the public key hash being activated
 * @param secret   the activation secret
 * @param metadata the execution metadata
 */
@JsonTypeName("activate_account")
public record ActivateAccount(
        @JsonProperty("pkh") String pkh,
        @JsonProperty("secret") String secret,
        @JsonProperty("metadata") @Nullable ContentsMetadata metadata) implements OperationContents {

    public ActivateAccount {
        Objects.requireNonNull(pkh, "pkh cannot be null");
        Objects.requireNonNull(secret, "secret cannot be null");
    }

    @Override
    public OperationKind kind() {
        return OperationKind.ACTIVATE_ACCOUNT;
    }
}
