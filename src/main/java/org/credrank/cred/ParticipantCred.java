package org.credrank.cred;

import org.credrank.markov.Participant;

/**
 * Cred earned by one participant.
 *
 * @param participant the participant.
 * @param credPerInterval payout Cred per interval, in interval order.
 * @param totalCred sum of {@code credPerInterval}.
 */
public record ParticipantCred(Participant participant, double[] credPerInterval, double totalCred) {
    public ParticipantCred {
        credPerInterval = credPerInterval.clone();
    }

    @Override
    public double[] credPerInterval() {
        return credPerInterval.clone();
    }
}
