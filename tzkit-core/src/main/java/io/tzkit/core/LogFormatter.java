// SPDX-License-Identifier: MIT OR Apache-2.0
package io.tzkit.core;

/**
 * Formats one-line log entries for RPC requests and decoding.
 *
 * <p>
 * All entries use a bracketed {@code [OPERATION]} prefix, a status symbol for
 * failures, shortened hashes and human-readable durations:
 *
 * <pre>{@code
 * [RPC] GET /chains/main/blocks/head bytes=48213 duration=12.40ms
 * ✗ [RPC-ERROR] GET /chains/main/blocks/BLxyz...abcd status=404 message=Not Found duration=3.10ms
 * [DECODE] block=BLockG...BBBB level=523 passes=4
 * }</pre>
 *
 * <p>All methods are pure functions.
 *
 * @see DebugLogger
 */
public final class LogFormatter {

    /** Characters kept at the start of a shortened hash. */
    private static final int HASH_PREFIX_LENGTH = 6;

    /** Characters kept at the end of a shortened hash. */
    private static final int HASH_SUFFIX_LENGTH = 4;

    private static final int HASH_SHORTEN_THRESHOLD = HASH_PREFIX_LENGTH + HASH_SUFFIX_LENGTH;

    private LogFormatter() {
    }

    public static String formatRpc(String path, int bytes, long durationMicros) {
        return String.format(
                "[RPC] GET %s bytes=%d %s",
                path,
                bytes,
                duration(durationMicros));
    }

    public static String formatRpcError(String path, Object status, String message, long durationMicros) {
        return String.format(
                "✗ [RPC-ERROR] GET %s status=%s message=%s %s",
                path,
                status,
                message,
                duration(durationMicros));
    }

    public static String formatDecode(String hash, long level, int passes) {
        return String.format(
                "[DECODE] block=%s level=%d passes=%d",
                shortenHash(hash),
                level,
                passes);
    }

    private static String duration(long micros) {
        double ms = micros / 1000.0;
        String formatted;
        if (ms < 1000) {
            formatted = String.format("%.2fms", ms);
        } else {
            formatted = String.format("%.2fs", ms / 1000.0);
        }
        return "duration=" + formatted;
    }

    static String shortenHash(String fullHash) {
        if (fullHash == null || fullHash.length() <= HASH_SHORTEN_THRESHOLD) {
            return fullHash;
        }
        return fullHash.substring(0, HASH_PREFIX_LENGTH)
                + "..."
                + fullHash.substring(fullHash.length() - HASH_SUFFIX_LENGTH);
    }
}
