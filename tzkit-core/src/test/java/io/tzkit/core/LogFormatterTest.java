// SPDX-License-Identifier: MIT OR Apache-2.0
package io.tzkit.core;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class LogFormatterTest {

    @Test
    void shortensLongHashes() {
        assertEquals("BLrUoU...fkZ6", LogFormatter.shortenHash("BLrUoUTUqBiDEmXcqRdmRb2Nv4hmuxwFhMD8aPkAUbSq3zsfkZ6"));
        assertEquals("short", LogFormatter.shortenHash("short"));
        assertNull(LogFormatter.shortenHash(null));
    }

    @Test
    void formatsRpcLine() {
        String line = LogFormatter.formatRpc("/chains/main/blocks/head", 42, 1_500L);
        assertTrue(line.startsWith("[RPC] GET /chains/main/blocks/head bytes=42 duration="));
    }

    @Test
    void formatsRpcErrorLine() {
        String line = LogFormatter.formatRpcError("/chains/main/blocks/head", 503, "HTTP 503", 2_000_000L);
        assertTrue(line.contains("[RPC-ERROR]"));
        assertTrue(line.contains("status=503"));
        assertTrue(line.contains("message=HTTP 503"));
    }

    @Test
    void formatsDecodeLine() {
        String line = LogFormatter.formatDecode("BLrUoUTUqBiDEmXcqRdmRb2Nv4hmuxwFhMD8aPkAUbSq3zsfkZ6", 699577L, 4);
        assertEquals("[DECODE] block=BLrUoU...fkZ6 level=699577 passes=4", line);
    }
}
