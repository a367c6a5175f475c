package org.credrank.core.address;

import java.util.Arrays;
import java.util.List;

/**
 * Address of an edge in the contribution graph or in the Markov process graph.
 */
public final class EdgeAddress extends Address<EdgeAddress> {
    static final char TAG = '\u0002';

    public static final EdgeAddress EMPTY = new EdgeAddress(List.of());

    private EdgeAddress(List<String> parts) {
        super(parts);
    }

    public static EdgeAddress of(String... parts) {
        return new EdgeAddress(Arrays.asList(parts));
    }

    public static EdgeAddress fromParts(List<String> parts) {
        return new EdgeAddress(parts);
    }

    public static EdgeAddress fromRawString(String raw) {
        return new EdgeAddress(parseRaw(raw, TAG, "EdgeAddress"));
    }

    @Override
    char tag() {
        return TAG;
    }

    @Override
    EdgeAddress create(List<String> parts) {
        return new EdgeAddress(parts);
    }
}
