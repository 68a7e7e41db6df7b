// SPDX-License-Identifier: MIT OR Apache-2.0
package io.tzkit.core.error;

/**
 * Base runtime exception for all tzkit failures.
 *
 * <p>
 * This sealed class forms the root of tzkit's exception hierarchy, so every
 * library error can be caught with a single catch clause while the concrete
 * subtypes stay exhaustive.
 *
 * <p>
 * <strong>Exception Hierarchy:</strong>
 * <pre>
 * TzkitException
 * ├── {@link RpcException} - the node could not be reached or answered with a non-success status
 * ├── {@link TransportException} - a retrieval operation failed in the transport
 * ├── {@link DecodeException} - a response did not match the expected schema
 * └── {@link InvalidIdentifierException} - a block identifier of an unsupported kind
 * </pre>
 *
 * <p>
 * <strong>Usage:</strong>
 *
 * <pre>{@code
 * try {
 *     Block block = reader.getBlock(id);
 * } catch (TransportException e) {
 *     // node unreachable, retry later
 * } catch (DecodeException e) {
 *     // protocol mismatch, inspect e.getCause()
 * } catch (TzkitException e) {
 *     // anything else
 * }
 * }</pre>
 */
public sealed class TzkitException extends RuntimeException
        permits RpcException,
        TransportException,
        DecodeException,
        InvalidIdentifierException {

    public TzkitException(final String message) {
        super(message);
    }

    public TzkitException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
