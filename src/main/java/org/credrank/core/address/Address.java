package org.credrank.core.address;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Immutable prefix-structured identifier shared by node and edge address spaces.
 *
 * <p>An address is an ordered sequence of string parts. Parts may be empty but
 * may not contain the NUL character, which terminates every part in the raw
 * string form. The raw form starts with a one-character tag so node and edge
 * addresses never collide.</p>
 *
 * @param <A> concrete address type.
 */
public abstract class Address<A extends Address<A>> implements Comparable<A> {
    static final char SEPARATOR = '\0';

    private final List<String> parts;
    private final int hash;

    Address(List<String> parts) {
        this.parts = copyAndValidateParts(parts);
        this.hash = 31 * tag() + this.parts.hashCode();
    }

    /**
     * One-character tag that starts the raw string form.
     */
    abstract char tag();

    /**
     * Creates a new address of the same kind from already-validated parts.
     */
    abstract A create(List<String> parts);

    /**
     * Returns the immutable part list.
     */
    public final List<String> toParts() {
        return parts;
    }

    /**
     * Returns number of parts.
     */
    public final int partCount() {
        return parts.size();
    }

    /**
     * Returns part at the given position.
     */
    public final String part(int index) {
        return parts.get(index);
    }

    /**
     * Returns a new address with the given parts appended.
     */
    public final A append(String... moreParts) {
        Objects.requireNonNull(moreParts, "moreParts");
        return append(Arrays.asList(moreParts));
    }

    /**
     * Returns a new address with the given parts appended.
     */
    public final A append(List<String> moreParts) {
        Objects.requireNonNull(moreParts, "moreParts");
        ArrayList<String> combined = new ArrayList<>(parts.size() + moreParts.size());
        combined.addAll(parts);
        combined.addAll(moreParts);
        return create(combined);
    }

    /**
     * Returns whether {@code prefix} is a (non-strict) part-wise prefix of this address.
     */
    public final boolean hasPrefix(A prefix) {
        Objects.requireNonNull(prefix, "prefix");
        List<String> prefixParts = prefix.toParts();
        if (prefixParts.size() > parts.size()) {
            return false;
        }
        for (int i = 0; i < prefixParts.size(); i++) {
            if (!prefixParts.get(i).equals(parts.get(i))) {
                return false;
            }
        }
        return true;
    }

    /**
     * Returns the injective raw string form: tag, then each part followed by NUL.
     */
    public final String toRawString() {
        StringBuilder sb = new StringBuilder(1 + parts.size() * 8);
        sb.append(tag());
        for (String part : parts) {
            sb.append(part).append(SEPARATOR);
        }
        return sb.toString();
    }

    /**
     * Lexicographic part order; a strict prefix sorts before its extensions.
     */
    @Override
    public final int compareTo(A other) {
        List<String> otherParts = other.toParts();
        int shared = Math.min(parts.size(), otherParts.size());
        for (int i = 0; i < shared; i++) {
            int cmp = parts.get(i).compareTo(otherParts.get(i));
            if (cmp != 0) {
                return cmp;
            }
        }
        return Integer.compare(parts.size(), otherParts.size());
    }

    @Override
    public final boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Address<?> other = (Address<?>) o;
        return hash == other.hash && parts.equals(other.parts);
    }

    @Override
    public final int hashCode() {
        return hash;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + parts;
    }

    /**
     * Splits a raw string into parts after validating tag and terminators.
     */
    static List<String> parseRaw(String raw, char expectedTag, String typeName) {
        if (raw == null || raw.isEmpty()) {
            throw new IllegalArgumentException(typeName + ": raw address must be non-empty");
        }
        if (raw.charAt(0) != expectedTag) {
            throw new IllegalArgumentException(
                    typeName + ": unexpected address tag 0x" + Integer.toHexString(raw.charAt(0))
            );
        }
        if (raw.length() > 1 && raw.charAt(raw.length() - 1) != SEPARATOR) {
            throw new IllegalArgumentException(typeName + ": raw address is not NUL-terminated");
        }
        ArrayList<String> parsed = new ArrayList<>();
        int start = 1;
        for (int i = 1; i < raw.length(); i++) {
            if (raw.charAt(i) == SEPARATOR) {
                parsed.add(raw.substring(start, i));
                start = i + 1;
            }
        }
        return parsed;
    }

    private static List<String> copyAndValidateParts(List<String> parts) {
        Objects.requireNonNull(parts, "parts");
        ArrayList<String> copy = new ArrayList<>(parts.size());
        for (int i = 0; i < parts.size(); i++) {
            String part = parts.get(i);
            if (part == null) {
                throw new IllegalArgumentException("address part " + i + " must be non-null");
            }
            if (part.indexOf(SEPARATOR) >= 0) {
                throw new IllegalArgumentException("address part " + i + " contains NUL: " + part.replace(SEPARATOR, '?'));
            }
            copy.add(part);
        }
        return Collections.unmodifiableList(copy);
    }
}
