package org.credrank.serialization.flexbuffers;

import com.google.flatbuffers.FlexBuffers;
import lombok.experimental.UtilityClass;
import org.credrank.core.CredRankException;

/**
 * Validates the type and version header of a Cred graph snapshot.
 */
@UtilityClass
public final class SnapshotContractValidator {
    public static final String SNAPSHOT_TYPE = "sourcecred/credrank/credGraph";
    public static final String SNAPSHOT_VERSION = "1.0.0";

    static final String KEY_TYPE = "type";
    static final String KEY_VERSION = "version";

    /**
     * Accepts snapshots of the expected type whose version shares the current major number.
     *
     * @param root snapshot root map.
     * @throws CredRankException {@code SNAPSHOT_VERSION} for a foreign type or incompatible version.
     */
    public static void validateHeader(FlexBuffers.Map root) {
        FlexBuffers.Reference type = root.get(KEY_TYPE);
        if (!type.isString() || !SNAPSHOT_TYPE.equals(type.asString())) {
            throw versionError("unexpected snapshot type: " + (type.isString() ? type.asString() : "<missing>"));
        }
        FlexBuffers.Reference version = root.get(KEY_VERSION);
        if (!version.isString()) {
            throw versionError("snapshot version missing");
        }
        String actual = version.asString();
        if (!majorVersion(actual).equals(majorVersion(SNAPSHOT_VERSION))) {
            throw versionError(
                    "unsupported snapshot version " + actual + " (expected " + majorVersion(SNAPSHOT_VERSION) + ".x)"
            );
        }
    }

    static String majorVersion(String version) {
        int dot = version.indexOf('.');
        return dot < 0 ? version : version.substring(0, dot);
    }

    static CredRankException versionError(String message) {
        return new CredRankException(CredRankException.REASON_SNAPSHOT_VERSION, message);
    }
}
