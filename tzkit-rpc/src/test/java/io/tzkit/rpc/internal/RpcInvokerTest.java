// SPDX-License-Identifier: MIT OR Apache-2.0
package io.tzkit.rpc.internal;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.when;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.atomic.AtomicBoolean;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import io.tzkit.core.error.DecodeException;
import io.tzkit.core.error.InvalidIdentifierException;
import io.tzkit.core.error.RpcException;
import io.tzkit.core.error.TransportException;
import io.tzkit.rpc.TezosProvider;

@ExtendWith(MockitoExtension.class)
class RpcInvokerTest {

    @Mock
    private TezosProvider provider;

    @Test
    void passesBodyToDecoder() {
        when(provider.get("/x")).thenReturn("abc".getBytes(StandardCharsets.UTF_8));

        String decoded = new RpcInvoker(provider).call("/x", "thing",
                body -> new String(body, StandardCharsets.UTF_8).toUpperCase());

        assertEquals("ABC", decoded);
    }

    @Test
    void transportFailureSkipsDecoder() {
        when(provider.get("/x")).thenThrow(new RpcException(503, "HTTP error 503", "/x", null));
        AtomicBoolean decoded = new AtomicBoolean();

        TransportException ex = assertThrows(TransportException.class,
                () -> new RpcInvoker(provider).call("/x", "thing", body -> {
                    decoded.set(true);
                    return body;
                }));

        assertEquals("could not get thing", ex.getMessage());
        assertFalse(decoded.get());
    }

    @Test
    void uncheckedProviderFailureBecomesTransportException() {
        UncheckedIOException cause = new UncheckedIOException(new IOException("connection reset"));
        when(provider.get("/x")).thenThrow(cause);
        AtomicBoolean decoded = new AtomicBoolean();

        TransportException ex = assertThrows(TransportException.class,
                () -> new RpcInvoker(provider).call("/x", "thing", body -> {
                    decoded.set(true);
                    return body;
                }));

        assertEquals("could not get thing", ex.getMessage());
        assertSame(cause, ex.getCause());
        assertNull(ex.rpcCause());
        assertFalse(decoded.get());
    }

    @Test
    void tzkitFailureFromProviderPassesThrough() {
        InvalidIdentifierException cause = new InvalidIdentifierException("bad id");
        when(provider.get("/x")).thenThrow(cause);

        InvalidIdentifierException ex = assertThrows(InvalidIdentifierException.class,
                () -> new RpcInvoker(provider).call("/x", "thing", body -> body));

        assertSame(cause, ex);
    }

    @Test
    void decoderIoFailureBecomesDecodeException() {
        when(provider.get("/x")).thenReturn(new byte[0]);
        IOException cause = new IOException("bad json");

        DecodeException ex = assertThrows(DecodeException.class,
                () -> new RpcInvoker(provider).call("/x", "thing", body -> {
                    throw cause;
                }));

        assertEquals("could not decode thing", ex.getMessage());
        assertSame(cause, ex.getCause());
    }

    @Test
    void decoderArgumentFailureBecomesDecodeException() {
        when(provider.get("/x")).thenReturn(new byte[0]);

        assertThrows(DecodeException.class,
                () -> new RpcInvoker(provider).call("/x", "thing", body -> {
                    throw new IllegalArgumentException("negative quantity");
                }));
    }
}
