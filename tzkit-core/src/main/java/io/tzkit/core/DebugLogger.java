// SPDX-License-Identifier: MIT OR Apache-2.0
package io.tzkit.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Centralized debug logger for transport and decoding traces.
 *
 * <p>Every entry point is a no-op unless the matching {@link TzkitDebug} toggle is on.
 * Output goes through SLF4J under the {@code io.tzkit.debug} logger after
 * {@link LogSanitizer} has redacted it.
 */
public final class DebugLogger {

    private static final Logger LOG = LoggerFactory.getLogger("io.tzkit.debug");

    private DebugLogger() {
    }

    public static void logRpc(final String message, final Object... args) {
        if (!TzkitDebug.isRpcLoggingEnabled()) {
            return;
        }
        logDirect(message, args);
    }

    public static void logDecode(final String message, final Object... args) {
        if (!TzkitDebug.isDecodeLoggingEnabled()) {
            return;
        }
        logDirect(message, args);
    }

    private static void logDirect(final String message, final Object... args) {
        final String formatted = (args == null || args.length == 0) ? message : message.formatted(args);
        LOG.info(LogSanitizer.sanitize(formatted));
    }
}
