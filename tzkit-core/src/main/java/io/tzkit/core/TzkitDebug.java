// SPDX-License-Identifier: MIT OR Apache-2.0
package io.tzkit.core;

/**
 * Global toggles for the {@link DebugLogger} traces. Both are off by default.
 *
 * <ul>
 * <li>RPC logging: one {@code [RPC]} line per request made by
 * {@code HttpTezosProvider} (path, response size, duration), or an
 * {@code [RPC-ERROR]} line with the status and message when it fails.</li>
 * <li>Decode logging: one {@code [DECODE]} line per block decoded by a
 * {@code BlockReader} (shortened hash, level, number of validation passes).</li>
 * </ul>
 *
 * <pre>{@code
 * TzkitDebug.setRpcLogging(true);   // only transport timing
 * TzkitDebug.setEnabled(true);      // both traces
 * }</pre>
 */
public final class TzkitDebug {

    private static volatile boolean rpcLogging = false;
    private static volatile boolean decodeLogging = false;

    private TzkitDebug() {
    }

    public static boolean isEnabled() {
        return rpcLogging || decodeLogging;
    }

    public static void setEnabled(final boolean enabled) {
        rpcLogging = enabled;
        decodeLogging = enabled;
    }

    public static void setRpcLogging(final boolean enabled) {
        rpcLogging = enabled;
    }

    public static boolean isRpcLoggingEnabled() {
        return rpcLogging;
    }

    public static void setDecodeLogging(final boolean enabled) {
        decodeLogging = enabled;
    }

    public static boolean isDecodeLoggingEnabled() {
        return decodeLogging;
    }
}
