// SPDX-License-Identifier: MIT OR Apache-2.0
package io.tzkit.core.model.operation;

import io.tzkit.core.types.Mutez;
import io.tzkit.core.types.Quantity;

/**
 * Contents signed by an implicit account that pay fees and consume gas.
 *
 * <p>Reveal, transaction, origination and delegation share these fields.
 */
public sealed interface ManagerOperation extends OperationContents
        permits Reveal, Transaction, Origination, Delegation {

    /** @return the account that signed and pays for the operation */
    String source();

    /** @return the fee paid to the baker, in mutez */
    Mutez fee();

    /** @return the source account's operation counter */
    Quantity counter();

    /** @return the gas limit */
    Quantity gasLimit();

    /** @return the storage limit, in bytes */
    Quantity storageLimit();
}
