package org.credrank.cred;

/**
 * Weight of a dependency mint policy from {@code startMs} on. {@link Long#MIN_VALUE} means since forever.
 */
public record DependencyMintPeriod(double weight, long startMs) {
    public static final long SINCE_FOREVER = Long.MIN_VALUE;
}
