package org.credrank.cred;

import org.credrank.markov.MarkovNode;

/**
 * A Markov process graph node with its Cred.
 */
public record CredNode(MarkovNode node, double cred) {
}
