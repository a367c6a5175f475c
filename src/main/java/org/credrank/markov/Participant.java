package org.credrank.markov;

import org.credrank.core.address.NodeAddress;

import java.util.Objects;

/**
 * A contribution-graph node that represents a person or identity.
 */
public record Participant(NodeAddress address, String description, ParticipantId id) {
    public Participant {
        Objects.requireNonNull(address, "address");
        Objects.requireNonNull(description, "description");
        Objects.requireNonNull(id, "id");
    }
}
