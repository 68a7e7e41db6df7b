// SPDX-License-Identifier: MIT OR Apache-2.0
package io.tzkit.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * Status of the governance test chain.
 *
 * <p>
 * {@code status} is {@code not_running}, {@code forking} or {@code running};
 * the remaining fields are only reported while a test chain exists.
 *
 * @param status     the test chain status
 * @param chainId    the test chain identifier
 * @param genesis    the test chain genesis block hash
 * @param protocol   the protocol under test
 * @param expiration the expiration timestamp
 */
public record TestChainStatus(
        @JsonProperty("status") String status,
        @JsonProperty("chain_id") @Nullable String chainId,
        @JsonProperty("genesis") @Nullable String genesis,
        @JsonProperty("protocol") @Nullable String protocol,
        @JsonProperty("expiration") @Nullable String expiration) {

    public TestChainStatus {
        Objects.requireNonNull(status, "status cannot be null");
    }

    @JsonIgnore
    public boolean isRunning() {
        return "running".equals(status);
    }
}
