// SPDX-License-Identifier: MIT OR Apache-2.0
package io.tzkit.core;

/**
 * Keeps debug log lines bounded: anything longer than 2000 characters, such
 * as an I/O error message quoting a large response, is truncated.
 */
public final class LogSanitizer {

    private static final int MAX_LOG_LENGTH = 2000;

    private static final String TRUNCATION_SUFFIX = "...(truncated)";

    private LogSanitizer() {}

    public static String sanitize(final String input) {
        if (input == null) {
            return "null";
        }

        if (input.length() <= MAX_LOG_LENGTH) {
            return input;
        }
        int truncateAt = Math.max(0, MAX_LOG_LENGTH - TRUNCATION_SUFFIX.length());
        return input.substring(0, truncateAt) + TRUNCATION_SUFFIX;
    }
}
