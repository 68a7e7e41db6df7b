// SPDX-License-Identifier: MIT OR Apache-2.0
package io.tzkit.core.error;

/**
 * Thrown when a node response cannot be decoded into the expected type.
 *
 * <p>
 * Raised for malformed JSON, missing required fields, unknown operation kinds
 * and values of the wrong shape. No partially decoded value is ever returned
 * alongside this exception.
 */
public final class DecodeException extends TzkitException {

    public DecodeException(final String message) {
        super(message);
    }

    public DecodeException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
