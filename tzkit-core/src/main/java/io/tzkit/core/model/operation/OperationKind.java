// SPDX-License-Identifier: MIT OR Apache-2.0
package io.tzkit.core.model.operation;

import java.util.Arrays;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * The {@code kind} discriminator of operation contents.
 *
 * <p>Each constant maps to exactly one {@link OperationContents} variant.
 */
public enum OperationKind {
    ENDORSEMENT("endorsement", Endorsement.class),
    ENDORSEMENT_WITH_SLOT("endorsement_with_slot", EndorsementWithSlot.class),
    SEED_NONCE_REVELATION("seed_nonce_revelation", SeedNonceRevelation.class),
    DOUBLE_ENDORSEMENT_EVIDENCE("double_endorsement_evidence", DoubleEndorsementEvidence.class),
    DOUBLE_BAKING_EVIDENCE("double_baking_evidence", DoubleBakingEvidence.class),
    ACTIVATE_ACCOUNT("activate_account", ActivateAccount.class),
    PROPOSALS("proposals", Proposals.class),
    BALLOT("ballot", Ballot.class),
    REVEAL("reveal", Reveal.class),
    TRANSACTION("transaction", Transaction.class),
    ORIGINATION("origination", Origination.class),
    DELEGATION("delegation", Delegation.class),
    FAILING_NOOP("failing_noop", FailingNoop.class);

    private static final Map<String, OperationKind> BY_WIRE_NAME = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(OperationKind::wireName, Function.identity()));

    private final String wireName;
    private final Class<? extends OperationContents> variant;

    OperationKind(final String wireName, final Class<? extends OperationContents> variant) {
        this.wireName = wireName;
        this.variant = variant;
    }

    /**
     * Returns the discriminator as it appears on the wire.
     *
     * @return the wire name, e.g. {@code "transaction"}
     */
    public String wireName() {
        return wireName;
    }

    /**
     * Returns the record type carrying this kind.
     *
     * @return the variant class
     */
    public Class<? extends OperationContents> variant() {
        return variant;
    }

    /**
     * Whether operations of this kind are signed by a manager account and pay fees.
     *
     * @return {@code true} for reveal, transaction, origination and delegation
     */
    public boolean isManager() {
        return ManagerOperation.class.isAssignableFrom(variant);
    }

    /**
     * Looks up a kind by its wire name.
     *
     * @param wireName the discriminator value
     * @return the kind
     * @throws IllegalArgumentException if the name is unknown
     */
    public static OperationKind fromWireName(final String wireName) {
        final OperationKind kind = BY_WIRE_NAME.get(wireName);
        if (kind == null) {
            throw new IllegalArgumentException("Unknown operation kind: " + wireName);
        }
        return kind;
    }

    @Override
    public String toString() {
        return wireName;
    }
}
