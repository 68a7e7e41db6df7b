// SPDX-License-Identifier: MIT OR Apache-2.0
package io.tzkit.rpc;

import io.tzkit.core.DebugLogger;
import io.tzkit.core.LogFormatter;
import io.tzkit.core.error.RpcException;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * {@link TezosProvider} backed by the JDK {@link HttpClient}.
 *
 * <p>
 * Issues {@code GET {url}{path}} with {@code Accept: application/json} plus
 * the configured headers. Non-2xx answers, I/O errors and interruption are
 * reported as {@link RpcException}. No retries.
 *
 * <pre>{@code
 * TezosProvider provider = HttpTezosProvider.builder("https://rpc.example.org")
 *         .readTimeout(Duration.ofSeconds(60))
 *         .header("X-Api-Key", key)
 *         .build();
 * }</pre>
 */
public final class HttpTezosProvider implements TezosProvider {

    private final RpcConfig config;
    private final HttpClient httpClient;

    private HttpTezosProvider(final RpcConfig config) {
        this.config = config;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(config.connectTimeout())
                .build();
    }

    public static Builder builder(final String url) {
        return new Builder(url);
    }

    public RpcConfig config() {
        return config;
    }

    @Override
    public byte[] get(final String path) throws RpcException {
        final HttpRequest request = buildRequest(path);

        final long start = System.nanoTime();
        final HttpResponse<byte[]> response = execute(request, path);
        final long durationMicros = (System.nanoTime() - start) / 1_000L;

        final byte[] body = response.body();
        if (response.statusCode() < 200 || response.statusCode() >= 300) {
            final String text = body == null ? null : new String(body, StandardCharsets.UTF_8);
            DebugLogger.logRpc(
                    LogFormatter.formatRpcError(path, response.statusCode(),
                            "HTTP " + response.statusCode(), durationMicros));
            throw new RpcException(
                    response.statusCode(),
                    "HTTP error " + response.statusCode(),
                    path,
                    text);
        }

        final byte[] safeBody = body == null ? new byte[0] : body;
        DebugLogger.logRpc(LogFormatter.formatRpc(path, safeBody.length, durationMicros));
        return safeBody;
    }

    private HttpRequest buildRequest(final String path) throws RpcException {
        final URI uri;
        try {
            uri = URI.create(config.url() + (path.startsWith("/") ? path : "/" + path));
        } catch (IllegalArgumentException e) {
            throw new RpcException("Invalid request path", path, e);
        }
        final HttpRequest.Builder builder = HttpRequest.newBuilder(uri)
                .header("Accept", "application/json")
                .timeout(config.readTimeout())
                .GET();

        for (Map.Entry<String, String> entry : config.headers().entrySet()) {
            builder.header(entry.getKey(), entry.getValue());
        }

        return builder.build();
    }

    private HttpResponse<byte[]> execute(final HttpRequest request, final String path) throws RpcException {
        try {
            return httpClient.send(request, HttpResponse.BodyHandlers.ofByteArray());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RpcException("Interrupted during RPC call", path, e);
        } catch (IOException e) {
            DebugLogger.logRpc(LogFormatter.formatRpcError(path, "-", e.getMessage(), 0L));
            throw new RpcException("Network error during RPC call", path, e);
        }
    }

    public static final class Builder {
        private final String url;
        private Duration connectTimeout = Duration.ofSeconds(10);
        private Duration readTimeout = Duration.ofSeconds(30);
        private final Map<String, String> headers = new LinkedHashMap<>();

        private Builder(final String url) {
            this.url = url;
        }

        public Builder connectTimeout(final Duration connectTimeout) {
            if (connectTimeout != null) {
                this.connectTimeout = connectTimeout;
            }
            return this;
        }

        public Builder readTimeout(final Duration readTimeout) {
            if (readTimeout != null) {
                this.readTimeout = readTimeout;
            }
            return this;
        }

        public Builder header(final String key, final String value) {
            headers.put(key, value);
            return this;
        }

        public HttpTezosProvider build() {
            final RpcConfig config = new RpcConfig(url, connectTimeout, readTimeout,
                    new LinkedHashMap<>(headers));
            return new HttpTezosProvider(config);
        }
    }
}
