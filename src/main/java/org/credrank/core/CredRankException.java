package org.credrank.core;

import lombok.Getter;

import java.util.Objects;

/**
 * CredRank contract exception with deterministic reason codes.
 *
 * <p>Every failure of the core surfaces as this exception; callers branch on
 * {@link #getReasonCode()} rather than on message text.</p>
 */
@Getter
public final class CredRankException extends RuntimeException {
    public static final String REASON_DUPLICATE_ADDRESS = "DUPLICATE_ADDRESS";
    public static final String REASON_DANGLING_EDGE = "DANGLING_EDGE";
    public static final String REASON_MERGE_CONFLICT = "MERGE_CONFLICT";
    public static final String REASON_WEIGHT_CONFLICT = "WEIGHT_CONFLICT";
    public static final String REASON_UNCLAIMED_ADDRESS = "UNCLAIMED_ADDRESS";
    public static final String REASON_PARAMETER_ERROR = "PARAMETER_ERROR";
    public static final String REASON_CONSTRUCTION_ERROR = "CONSTRUCTION_ERROR";
    public static final String REASON_NONCONVERGENT = "NONCONVERGENT";
    public static final String REASON_POLICY_ERROR = "POLICY_ERROR";
    public static final String REASON_UNKNOWN_RECIPIENT = "UNKNOWN_RECIPIENT";
    public static final String REASON_SNAPSHOT_VERSION = "SNAPSHOT_VERSION";

    private final String reasonCode;

    /**
     * Creates a reason-coded failure.
     *
     * @param reasonCode deterministic reason code.
     * @param message descriptive error message.
     */
    public CredRankException(String reasonCode, String message) {
        super(formatMessage(reasonCode, message));
        this.reasonCode = requireReasonCode(reasonCode);
    }

    /**
     * Creates a reason-coded failure with a cause.
     *
     * @param reasonCode deterministic reason code.
     * @param message descriptive error message.
     * @param cause underlying cause.
     */
    public CredRankException(String reasonCode, String message, Throwable cause) {
        super(formatMessage(reasonCode, message), cause);
        this.reasonCode = requireReasonCode(reasonCode);
    }

    private static String formatMessage(String reasonCode, String message) {
        return "[" + requireReasonCode(reasonCode) + "] " + Objects.requireNonNull(message, "message");
    }

    private static String requireReasonCode(String reasonCode) {
        String code = Objects.requireNonNull(reasonCode, "reasonCode");
        if (code.isBlank()) {
            throw new IllegalArgumentException("reasonCode must be non-blank");
        }
        return code;
    }
}
