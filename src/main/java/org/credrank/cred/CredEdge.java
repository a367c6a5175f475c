package org.credrank.cred;

import org.credrank.markov.MarkovEdge;

/**
 * A Markov process graph edge with the Cred flowing along it.
 */
public record CredEdge(MarkovEdge edge, double credFlow) {
}
