package org.credrank.markov;

import org.credrank.core.CredRankException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

@DisplayName("Parameters Validation Tests")
class ParametersTest {

    @ParameterizedTest(name = "[{index}] alpha={0}, beta={1}, gammaForward={2}, gammaBackward={3}")
    @CsvSource({
            "0.21, 0.4, 0.2, 0.2",
            "0.2, 0.41, 0.2, 0.2",
            "0.2, 0.4, 0.21, 0.2",
            "0.2, 0.4, 0.2, 0.21",
            "0.0, 0.5, 0.25, 0.25",
            "-0.1, 0.1, 0.1, 0.1",
            "1.1, 0.0, 0.0, 0.0",
            "NaN, 0.1, 0.1, 0.1",
            "0.2, Infinity, 0.0, 0.0"
    })
    @DisplayName("Invalid combinations are rejected with PARAMETER_ERROR")
    void testRejectsInvalid(double alpha, double beta, double gammaForward, double gammaBackward) {
        CredRankException ex = assertThrows(
                CredRankException.class,
                () -> new Parameters(alpha, beta, gammaForward, gammaBackward)
        );
        assertEquals(CredRankException.REASON_PARAMETER_ERROR, ex.getReasonCode());
    }

    @Test
    @DisplayName("Boundary values are accepted")
    void testBoundaries() {
        Parameters onlyAlpha = Parameters.builder().alpha(1.0d).build();
        assertEquals(0.0d, onlyAlpha.epochContributionBudget());
        Parameters full = new Parameters(0.25d, 0.25d, 0.25d, 0.25d);
        assertEquals(0.0d, full.epochContributionBudget());
        Parameters scenario = new Parameters(0.2d, 0.2d, 0.15d, 0.1d);
        assertEquals(0.35d, scenario.epochContributionBudget(), 1e-12);
    }

    @Test
    @DisplayName("Defaults come from system properties when set")
    void testDefaultsFromSystemProperties() {
        assertEquals(new Parameters(0.2d, 0.4d, 0.1d, 0.1d), Parameters.defaults());
        System.setProperty(Parameters.PROP_BETA, "0.3");
        try {
            assertEquals(0.3d, Parameters.defaults().beta());
            System.setProperty(Parameters.PROP_BETA, "not-a-number");
            CredRankException ex = assertThrows(CredRankException.class, Parameters::defaults);
            assertEquals(CredRankException.REASON_PARAMETER_ERROR, ex.getReasonCode());
        } finally {
            System.clearProperty(Parameters.PROP_BETA);
        }
    }
}
