// SPDX-License-Identifier: MIT OR Apache-2.0
package io.tzkit.core;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class TzkitDebugTest {

    @AfterEach
    void reset() {
        TzkitDebug.setEnabled(false);
    }

    @Test
    void disabledByDefault() {
        assertFalse(TzkitDebug.isEnabled());
        assertFalse(TzkitDebug.isRpcLoggingEnabled());
        assertFalse(TzkitDebug.isDecodeLoggingEnabled());
    }

    @Test
    void togglesAreIndependent() {
        TzkitDebug.setRpcLogging(true);
        assertTrue(TzkitDebug.isEnabled());
        assertTrue(TzkitDebug.isRpcLoggingEnabled());
        assertFalse(TzkitDebug.isDecodeLoggingEnabled());

        TzkitDebug.setRpcLogging(false);
        TzkitDebug.setDecodeLogging(true);
        assertTrue(TzkitDebug.isEnabled());
        assertFalse(TzkitDebug.isRpcLoggingEnabled());
    }

    @Test
    void setEnabledSwitchesBoth() {
        TzkitDebug.setEnabled(true);
        assertTrue(TzkitDebug.isRpcLoggingEnabled());
        assertTrue(TzkitDebug.isDecodeLoggingEnabled());

        // gated calls must not throw either way
        DebugLogger.logRpc(LogFormatter.formatRpc("/chains/main/blocks/head", 10, 5L));
        DebugLogger.logDecode("[DECODE] %s", "x".repeat(5000));
    }
}
