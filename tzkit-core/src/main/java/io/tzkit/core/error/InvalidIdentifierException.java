// SPDX-License-Identifier: MIT OR Apache-2.0
package io.tzkit.core.error;

/**
 * Thrown when a block identifier is neither a level (integer) nor a block hash (string).
 */
public final class InvalidIdentifierException extends TzkitException {

    public InvalidIdentifierException(final String message) {
        super(message);
    }

    public InvalidIdentifierException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
