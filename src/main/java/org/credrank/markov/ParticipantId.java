package org.credrank.markov;

import java.util.Objects;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Stable opaque 16-byte participant identifier.
 *
 * <p>The canonical string form is 32 lowercase hex characters; ordering is
 * lexicographic over that form, which equals unsigned byte order.</p>
 */
public final class ParticipantId implements Comparable<ParticipantId> {
    private static final Pattern CANONICAL = Pattern.compile("[0-9a-f]{32}");

    private final long mostSignificantBits;
    private final long leastSignificantBits;
    private final String hex;

    private ParticipantId(long mostSignificantBits, long leastSignificantBits) {
        this.mostSignificantBits = mostSignificantBits;
        this.leastSignificantBits = leastSignificantBits;
        this.hex = toHex(mostSignificantBits) + toHex(leastSignificantBits);
    }

    public static ParticipantId of(long mostSignificantBits, long leastSignificantBits) {
        return new ParticipantId(mostSignificantBits, leastSignificantBits);
    }

    public static ParticipantId fromUuid(UUID uuid) {
        Objects.requireNonNull(uuid, "uuid");
        return new ParticipantId(uuid.getMostSignificantBits(), uuid.getLeastSignificantBits());
    }

    public static ParticipantId random() {
        return fromUuid(UUID.randomUUID());
    }

    /**
     * Parses the canonical form: exactly 32 lowercase hex characters, no sign.
     */
    public static ParticipantId parse(String hex) {
        Objects.requireNonNull(hex, "hex");
        if (!CANONICAL.matcher(hex).matches()) {
            throw new IllegalArgumentException("participant id must be 32 lowercase hex characters: " + hex);
        }
        return new ParticipantId(
                Long.parseUnsignedLong(hex.substring(0, 16), 16),
                Long.parseUnsignedLong(hex.substring(16), 16)
        );
    }

    public UUID toUuid() {
        return new UUID(mostSignificantBits, leastSignificantBits);
    }

    @Override
    public int compareTo(ParticipantId other) {
        int cmp = Long.compareUnsigned(mostSignificantBits, other.mostSignificantBits);
        return cmp != 0 ? cmp : Long.compareUnsigned(leastSignificantBits, other.leastSignificantBits);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ParticipantId other)) {
            return false;
        }
        return mostSignificantBits == other.mostSignificantBits && leastSignificantBits == other.leastSignificantBits;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(mostSignificantBits) * 31 + Long.hashCode(leastSignificantBits);
    }

    @Override
    public String toString() {
        return hex;
    }

    private static String toHex(long bits) {
        String raw = Long.toHexString(bits);
        return "0".repeat(16 - raw.length()) + raw;
    }
}
