// SPDX-License-Identifier: MIT OR Apache-2.0
package io.tzkit.core.model.operation;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import org.jspecify.annotations.Nullable;

/**
 * One logical operation inside an {@link io.tzkit.core.model.OperationGroup}.
 *
 * <p>
 * On the wire every kind shares one flat object whose {@code kind} field says
 * which of the other fields are populated. Decoding dispatches on that field
 * to one record per kind, and each record carries only the fields of its kind.
 * Encoding writes {@code kind} back first. An unknown {@code kind} is a decoding
 * error.
 *
 * <p>
 * <strong>Usage:</strong>
 * <pre>{@code
 * for (OperationContents contents : group.contents()) {
 *     if (contents instanceof Transaction tx) {
 *         System.out.println(tx.source() + " -> " + tx.destination() + ": " + tx.amount());
 *     } else if (contents instanceof Ballot ballot) {
 *         System.out.println(ballot.source() + " voted " + ballot.ballot());
 *     }
 * }
 * }</pre>
 *
 * @see OperationKind
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "kind")
@JsonSubTypes({
    @JsonSubTypes.Type(value = Endorsement.class, name = "endorsement"),
    @JsonSubTypes.Type(value = EndorsementWithSlot.class, name = "endorsement_with_slot"),
    @JsonSubTypes.Type(value = SeedNonceRevelation.class, name = "seed_nonce_revelation"),
    @JsonSubTypes.Type(value = DoubleEndorsementEvidence.class, name = "double_endorsement_evidence"),
    @JsonSubTypes.Type(value = DoubleBakingEvidence.class, name = "double_baking_evidence"),
    @JsonSubTypes.Type(value = ActivateAccount.class, name = "activate_account"),
    @JsonSubTypes.Type(value = Proposals.class, name = "proposals"),
    @JsonSubTypes.Type(value = Ballot.class, name = "ballot"),
    @JsonSubTypes.Type(value = Reveal.class, name = "reveal"),
    @JsonSubTypes.Type(value = Transaction.class, name = "transaction"),
    @JsonSubTypes.Type(value = Origination.class, name = "origination"),
    @JsonSubTypes.Type(value = Delegation.class, name = "delegation"),
    @JsonSubTypes.Type(value = FailingNoop.class, name = "failing_noop")
})
public sealed interface OperationContents
        permits Endorsement,
        EndorsementWithSlot,
        SeedNonceRevelation,
        DoubleEndorsementEvidence,
        DoubleBakingEvidence,
        ActivateAccount,
        Proposals,
        Ballot,
        FailingNoop,
        ManagerOperation {

    /**
     * Returns the operation kind.
     *
     * @return the kind discriminator
     */
    OperationKind kind();

    /**
     * Returns the execution metadata attached by the node.
     *
     * @return the metadata, or {@code null} if the node did not report any
     */
    @Nullable ContentsMetadata metadata();
}
