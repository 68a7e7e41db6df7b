// SPDX-License-Identifier: MIT OR Apache-2.0
package io.tzkit.rpc;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * Connection settings of an {@link HttpTezosProvider}.
 *
 * @param url            the node RPC root, without trailing slash
 * @param connectTimeout the TCP connect timeout
 * @param readTimeout    the per-request timeout
 * @param headers        extra headers sent with every request (API keys, ...)
 */
public record RpcConfig(
        String url,
        Duration connectTimeout,
        Duration readTimeout,
        Map<String, String> headers) {

    private static final Duration DEFAULT_CONNECT = Duration.ofSeconds(10);
    private static final Duration DEFAULT_READ = Duration.ofSeconds(30);

    public RpcConfig {
        Objects.requireNonNull(url, "url");
        if (url.isBlank()) {
            throw new IllegalArgumentException("url cannot be blank");
        }
        url = url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
        connectTimeout = connectTimeout == null ? DEFAULT_CONNECT : connectTimeout;
        readTimeout = readTimeout == null ? DEFAULT_READ : readTimeout;
        headers = headers == null ? Map.of() : Map.copyOf(headers);
    }

    public static RpcConfig withDefaults(final String url) {
        return new RpcConfig(url, DEFAULT_CONNECT, DEFAULT_READ, Map.of());
    }
}
