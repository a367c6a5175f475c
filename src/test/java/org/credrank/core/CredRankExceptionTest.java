package org.credrank.core;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

@DisplayName("CredRankException Tests")
class CredRankExceptionTest {

    @Test
    @DisplayName("Message is prefixed with the reason code")
    void testMessageFormat() {
        CredRankException ex = new CredRankException(CredRankException.REASON_POLICY_ERROR, "bad period");
        assertEquals("POLICY_ERROR", ex.getReasonCode());
        assertEquals("[POLICY_ERROR] bad period", ex.getMessage());
    }

    @Test
    @DisplayName("Cause is preserved")
    void testCause() {
        IllegalStateException cause = new IllegalStateException("boom");
        CredRankException ex = new CredRankException(CredRankException.REASON_NONCONVERGENT, "wrapped", cause);
        assertSame(cause, ex.getCause());
    }

    @Test
    @DisplayName("Blank reason codes are rejected")
    void testBlankReasonCode() {
        assertThrows(IllegalArgumentException.class, () -> new CredRankException(" ", "msg"));
        assertThrows(NullPointerException.class, () -> new CredRankException(null, "msg"));
    }
}
