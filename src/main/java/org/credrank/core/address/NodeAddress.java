package org.credrank.core.address;

import java.util.Arrays;
import java.util.List;

/**
 * Address of a node in the contribution graph or in the Markov process graph.
 */
public final class NodeAddress extends Address<NodeAddress> {
    static final char TAG = '\u0001';

    public static final NodeAddress EMPTY = new NodeAddress(List.of());

    private NodeAddress(List<String> parts) {
        super(parts);
    }

    /**
     * Creates an address from the given parts.
     */
    public static NodeAddress of(String... parts) {
        return new NodeAddress(Arrays.asList(parts));
    }

    /**
     * Creates an address from the given part list.
     */
    public static NodeAddress fromParts(List<String> parts) {
        return new NodeAddress(parts);
    }

    /**
     * Parses the raw form produced by {@link #toRawString()}.
     */
    public static NodeAddress fromRawString(String raw) {
        return new NodeAddress(parseRaw(raw, TAG, "NodeAddress"));
    }

    @Override
    char tag() {
        return TAG;
    }

    @Override
    NodeAddress create(List<String> parts) {
        return new NodeAddress(parts);
    }
}
