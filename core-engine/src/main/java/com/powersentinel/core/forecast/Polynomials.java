package com.powersentinel.core.forecast;

import org.apache.commons.math3.analysis.solvers.LaguerreSolver;
import org.apache.commons.math3.complex.Complex;
import org.apache.commons.math3.exception.MathArithmeticException;
import org.apache.commons.math3.exception.MathIllegalArgumentException;
import org.apache.commons.math3.exception.MathIllegalStateException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Root checks for lag polynomials {@code 1 + c1 z + ... + ck z^k}.
 */
final class Polynomials {

    private static final Logger LOG = LoggerFactory.getLogger(Polynomials.class);

    private Polynomials() {
        // utility class — not instantiable
    }

    /**
     * @param coefficients {@code c1..ck}; the constant term is always 1
     * @return {@code true} if every root lies strictly outside the unit
     *         circle, i.e. the AR part is stationary or the MA part is
     *         invertible
     */
    static boolean rootsOutsideUnitCircle(double[] coefficients) {
        int degree = coefficients.length;
        while (degree > 0 && coefficients[degree - 1] == 0.0) {
            degree--;
        }
        if (degree == 0) {
            return true;
        }
        if (degree == 1) {
            return Math.abs(coefficients[0]) < 1.0;
        }

        double[] ascending = new double[degree + 1];
        ascending[0] = 1.0;
        System.arraycopy(coefficients, 0, ascending, 1, degree);
        try {
            Complex[] roots = new LaguerreSolver().solveAllComplex(ascending, 0.0);
            for (Complex root : roots) {
                if (root.abs() <= 1.0) {
                    return false;
                }
            }
            return true;
        } catch (MathIllegalStateException | MathArithmeticException | MathIllegalArgumentException e) {
            LOG.trace("Root finding failed for lag polynomial of degree {}: {}", degree, e.getMessage());
            return false;
        }
    }
}
