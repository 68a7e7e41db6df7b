// SPDX-License-Identifier: MIT OR Apache-2.0
package io.tzkit.rpc;

import static org.junit.jupiter.api.Assertions.*;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import io.tzkit.core.error.RpcException;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class HttpTezosProviderTest {

    private HttpServer server;
    private URI baseUri;

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress(0), 0);
        server.start();
        baseUri = URI.create("http://127.0.0.1:" + server.getAddress().getPort());
    }

    @AfterEach
    void tearDown() {
        server.stop(0);
    }

    @Test
    void returnsBodyOnSuccess() {
        AtomicReference<String> requestedPath = new AtomicReference<>();
        AtomicReference<String> method = new AtomicReference<>();
        server.createContext(
                "/",
                exchange -> {
                    requestedPath.set(exchange.getRequestURI().getPath());
                    method.set(exchange.getRequestMethod());
                    respond(exchange, 200, "[\"op1\",\"op2\"]");
                });

        TezosProvider provider = HttpTezosProvider.builder(baseUri.toString()).build();
        byte[] body = provider.get("/chains/main/blocks/head/operation_hashes");

        assertEquals("[\"op1\",\"op2\"]", new String(body, StandardCharsets.UTF_8));
        assertEquals("/chains/main/blocks/head/operation_hashes", requestedPath.get());
        assertEquals("GET", method.get());
    }

    @Test
    void trailingSlashInUrlIsIgnored() {
        AtomicReference<String> requestedPath = new AtomicReference<>();
        server.createContext(
                "/",
                exchange -> {
                    requestedPath.set(exchange.getRequestURI().getPath());
                    respond(exchange, 200, "{}");
                });

        TezosProvider provider = HttpTezosProvider.builder(baseUri + "/").build();
        provider.get("/chains/main/blocks/head");

        assertEquals("/chains/main/blocks/head", requestedPath.get());
    }

    @Test
    void sendsConfiguredHeaders() {
        AtomicReference<String> auth = new AtomicReference<>();
        AtomicReference<String> accept = new AtomicReference<>();
        server.createContext(
                "/",
                exchange -> {
                    auth.set(exchange.getRequestHeaders().getFirst("Authorization"));
                    accept.set(exchange.getRequestHeaders().getFirst("Accept"));
                    respond(exchange, 200, "{}");
                });

        TezosProvider provider = HttpTezosProvider.builder(baseUri.toString())
                .header("Authorization", "Bearer token-123")
                .readTimeout(Duration.ofSeconds(5))
                .build();
        provider.get("/chains/main/blocks/head");

        assertEquals("Bearer token-123", auth.get());
        assertEquals("application/json", accept.get());
    }

    @Test
    void httpErrorCarriesStatusAndBody() {
        server.createContext(
                "/",
                exchange -> respond(exchange, 404, "[{\"kind\":\"permanent\",\"id\":\"proto.block_not_found\"}]"));

        TezosProvider provider = HttpTezosProvider.builder(baseUri.toString()).build();
        RpcException ex = assertThrows(
                RpcException.class,
                () -> provider.get("/chains/main/blocks/BLmissing"));

        assertEquals(404, ex.statusCode());
        assertTrue(ex.isNotFound());
        assertEquals("/chains/main/blocks/BLmissing", ex.path());
        assertTrue(ex.body().contains("block_not_found"));
    }

    @Test
    void serverErrorIsNotNotFound() {
        server.createContext("/", exchange -> respond(exchange, 500, "internal error"));

        TezosProvider provider = HttpTezosProvider.builder(baseUri.toString()).build();
        RpcException ex = assertThrows(RpcException.class, () -> provider.get("/chains/main/blocks/head"));

        assertEquals(500, ex.statusCode());
        assertFalse(ex.isNotFound());
    }

    @Test
    void networkErrorHasNoStatus() throws IOException {
        int closedPort;
        try (ServerSocket socket = new ServerSocket(0)) {
            closedPort = socket.getLocalPort();
        }

        TezosProvider provider = HttpTezosProvider.builder("http://127.0.0.1:" + closedPort)
                .connectTimeout(Duration.ofSeconds(2))
                .build();
        RpcException ex = assertThrows(RpcException.class, () -> provider.get("/chains/main/blocks/head"));

        assertFalse(ex.hasStatus());
        assertInstanceOf(IOException.class, ex.getCause());
    }

    @Test
    void staticFactoryUsesDefaults() {
        HttpTezosProvider provider = (HttpTezosProvider) TezosProvider.http(baseUri.toString());
        assertEquals(Duration.ofSeconds(10), provider.config().connectTimeout());
        assertEquals(Duration.ofSeconds(30), provider.config().readTimeout());
    }

    private static void respond(HttpExchange exchange, int status, String body) throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().add("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }
}
