package com.powersentinel.core.forecast;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link Polynomials}.
 */
class PolynomialsTest {

    @Test
    @DisplayName("Should accept the constant polynomial and trailing zero coefficients")
    void shouldAcceptDegreeZero() {
        assertThat(Polynomials.rootsOutsideUnitCircle(new double[0])).isTrue();
        assertThat(Polynomials.rootsOutsideUnitCircle(new double[] {0.0, 0.0})).isTrue();
    }

    @Test
    @DisplayName("Should classify first-order polynomials by coefficient magnitude")
    void shouldCheckDegreeOne() {
        assertThat(Polynomials.rootsOutsideUnitCircle(new double[] {-0.9})).isTrue();
        assertThat(Polynomials.rootsOutsideUnitCircle(new double[] {1.0})).isFalse();
        assertThat(Polynomials.rootsOutsideUnitCircle(new double[] {-1.2, 0.0})).isFalse();
    }

    @Test
    @DisplayName("Should detect stationary and explosive AR(2) polynomials")
    void shouldCheckDegreeTwo() {
        // 1 - 0.5z - 0.3z^2: phi1 + phi2 < 1
        assertThat(Polynomials.rootsOutsideUnitCircle(new double[] {-0.5, -0.3})).isTrue();
        // 1 - 0.5z - 0.6z^2: phi1 + phi2 > 1
        assertThat(Polynomials.rootsOutsideUnitCircle(new double[] {-0.5, -0.6})).isFalse();
        // complex pair with modulus 1/sqrt(0.5) > 1
        assertThat(Polynomials.rootsOutsideUnitCircle(new double[] {0.0, 0.5})).isTrue();
    }
}
