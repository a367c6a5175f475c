package org.credrank.markov;

import org.credrank.core.CredRankException;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Indexed, validated personal attributions.
 *
 * <p>A participant may attribute a time-varying proportion of their payout to
 * other participants. For an epoch starting at {@code s}, the proportion in
 * effect is the last one whose {@code timestampMs <= s}; before the first
 * proportion nothing is attributed.</p>
 */
public final class PersonalAttributions {
    private static final PersonalAttributions EMPTY = new PersonalAttributions(List.of());
    private static final double SUM_TOLERANCE = 1e-12d;

    private final List<PersonalAttribution> attributions;
    private final Map<ParticipantId, List<AttributionRecipient>> recipientsBySource;

    private PersonalAttributions(List<PersonalAttribution> attributions) {
        this.attributions = List.copyOf(attributions);
        LinkedHashMap<ParticipantId, List<AttributionRecipient>> index = new LinkedHashMap<>();
        for (PersonalAttribution attribution : this.attributions) {
            index.put(attribution.fromParticipantId(), attribution.recipients());
        }
        this.recipientsBySource = index;
    }

    public static PersonalAttributions empty() {
        return EMPTY;
    }

    /**
     * Validates and indexes the given attributions.
     *
     * @throws CredRankException {@code PARAMETER_ERROR} for duplicate sources or recipients,
     *                           self attribution, out-of-order or out-of-range proportions.
     */
    public static PersonalAttributions of(List<PersonalAttribution> attributions) {
        Objects.requireNonNull(attributions, "attributions");
        Set<ParticipantId> sources = new HashSet<>();
        for (PersonalAttribution attribution : attributions) {
            Objects.requireNonNull(attribution, "attribution");
            if (!sources.add(attribution.fromParticipantId())) {
                throw parameterError("more than one attribution from " + attribution.fromParticipantId());
            }
            Set<ParticipantId> targets = new HashSet<>();
            for (AttributionRecipient recipient : attribution.recipients()) {
                if (recipient.toParticipantId().equals(attribution.fromParticipantId())) {
                    throw parameterError(attribution.fromParticipantId() + " attributes cred to itself");
                }
                if (!targets.add(recipient.toParticipantId())) {
                    throw parameterError(
                            "more than one recipient entry for " + recipient.toParticipantId()
                                    + " from " + attribution.fromParticipantId()
                    );
                }
                validateProportions(attribution.fromParticipantId(), recipient);
            }
        }
        return new PersonalAttributions(attributions);
    }

    public List<PersonalAttribution> attributions() {
        return attributions;
    }

    public boolean isEmpty() {
        return attributions.isEmpty();
    }

    /**
     * Participants that {@code from} attributes to, in declaration order.
     */
    public List<ParticipantId> recipients(ParticipantId from) {
        List<AttributionRecipient> recipients = recipientsBySource.get(from);
        if (recipients == null) {
            return List.of();
        }
        ArrayList<ParticipantId> ids = new ArrayList<>(recipients.size());
        for (AttributionRecipient recipient : recipients) {
            ids.add(recipient.toParticipantId());
        }
        return ids;
    }

    /**
     * Proportion in effect for an epoch starting at {@code epochStartMs}, or 0.
     */
    public double proportion(long epochStartMs, ParticipantId from, ParticipantId to) {
        List<AttributionRecipient> recipients = recipientsBySource.get(from);
        if (recipients == null) {
            return 0.0d;
        }
        for (AttributionRecipient recipient : recipients) {
            if (recipient.toParticipantId().equals(to)) {
                return proportionAt(recipient, epochStartMs);
            }
        }
        return 0.0d;
    }

    /**
     * Total attributed proportion of {@code from} for the epoch.
     *
     * @throws CredRankException {@code PARAMETER_ERROR} when the total exceeds 1.
     */
    public double totalProportion(long epochStartMs, ParticipantId from) {
        List<AttributionRecipient> recipients = recipientsBySource.get(from);
        if (recipients == null) {
            return 0.0d;
        }
        double sum = 0.0d;
        for (AttributionRecipient recipient : recipients) {
            sum += proportionAt(recipient, epochStartMs);
        }
        if (sum > 1.0d + SUM_TOLERANCE) {
            throw parameterError(
                    from + " attributes more than all of its cred in epoch starting " + epochStartMs + ": " + sum
            );
        }
        return Math.min(sum, 1.0d);
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof PersonalAttributions other && attributions.equals(other.attributions));
    }

    @Override
    public int hashCode() {
        return attributions.hashCode();
    }

    private static double proportionAt(AttributionRecipient recipient, long epochStartMs) {
        double value = 0.0d;
        for (AttributionProportion proportion : recipient.proportions()) {
            if (proportion.timestampMs() > epochStartMs) {
                break;
            }
            value = proportion.proportionValue();
        }
        return value;
    }

    private static void validateProportions(ParticipantId from, AttributionRecipient recipient) {
        long previous = Long.MIN_VALUE;
        for (AttributionProportion proportion : recipient.proportions()) {
            if (proportion.timestampMs() < previous) {
                throw parameterError(
                        "attribution proportions from " + from + " to " + recipient.toParticipantId()
                                + " are not in chronological order"
                );
            }
            previous = proportion.timestampMs();
            double value = proportion.proportionValue();
            if (!Double.isFinite(value) || value < 0.0d || value > 1.0d) {
                throw parameterError("attribution proportion must be in [0, 1], got " + value);
            }
        }
    }

    private static CredRankException parameterError(String message) {
        return new CredRankException(CredRankException.REASON_PARAMETER_ERROR, message);
    }

    /**
     * Proportion taking effect from {@code timestampMs} on.
     */
    public record AttributionProportion(long timestampMs, double proportionValue) {
    }

    /**
     * A recipient with its chronological proportion log.
     */
    public record AttributionRecipient(ParticipantId toParticipantId, List<AttributionProportion> proportions) {
        public AttributionRecipient {
            Objects.requireNonNull(toParticipantId, "toParticipantId");
            proportions = List.copyOf(Objects.requireNonNull(proportions, "proportions"));
        }
    }

    /**
     * Everything one participant attributes.
     */
    public record PersonalAttribution(ParticipantId fromParticipantId, List<AttributionRecipient> recipients) {
        public PersonalAttribution {
            Objects.requireNonNull(fromParticipantId, "fromParticipantId");
            recipients = List.copyOf(Objects.requireNonNull(recipients, "recipients"));
        }
    }
}
