package com.powersentinel.core.forecast;

import com.powersentinel.core.error.ModelFitException;
import com.powersentinel.core.model.ModelOrder;
import com.powersentinel.core.model.TimeSeries;
import org.apache.commons.math3.exception.MathArithmeticException;
import org.apache.commons.math3.exception.MathIllegalArgumentException;
import org.apache.commons.math3.exception.MathIllegalStateException;
import org.apache.commons.math3.exception.TooManyEvaluationsException;
import org.apache.commons.math3.optim.InitialGuess;
import org.apache.commons.math3.optim.MaxEval;
import org.apache.commons.math3.optim.PointValuePair;
import org.apache.commons.math3.optim.SimpleValueChecker;
import org.apache.commons.math3.optim.nonlinear.scalar.GoalType;
import org.apache.commons.math3.optim.nonlinear.scalar.ObjectiveFunction;
import org.apache.commons.math3.optim.nonlinear.scalar.noderiv.NelderMeadSimplex;
import org.apache.commons.math3.optim.nonlinear.scalar.noderiv.SimplexOptimizer;
import org.apache.commons.math3.stat.StatUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;

/**
 * Conditional-sum-of-squares estimation of ARIMA(p, d, q).
 *
 * <h3>Model</h3>
 * <p>
 * The training series is differenced {@code d} times into {@code w}. On
 * {@code w} an ARMA(p, q) with mean {@code mu} is fitted ({@code mu} is a
 * free parameter only when {@code d == 0}):
 * </p>
 *
 * <pre>
 * e[t] = w[t] - mu - sum(phi[i] * (w[t-i] - mu)) - sum(theta[j] * e[t-j])
 * </pre>
 *
 * <p>
 * The first {@code p} rows condition the recursion and innovations before
 * them are zero. The sum of squared innovations is minimised with a bounded
 * Nelder–Mead simplex; parameter vectors whose AR polynomial is not
 * stationary or whose MA polynomial is not invertible are penalised.
 * </p>
 *
 * <h3>Scoring</h3>
 * <p>
 * {@code sigma2 = SSR / n}, Gaussian log-likelihood
 * {@code -n/2 * (ln(2 pi sigma2) + 1)}, {@code AIC = -2 logL + 2 (k + 1)}
 * where {@code n} is the number of innovations and {@code k} the number of
 * mean parameters.
 * </p>
 */
class ArimaEstimator {

    private static final Logger LOG = LoggerFactory.getLogger(ArimaEstimator.class);

    private static final double PENALTY = 1e100;
    private static final double COEFFICIENT_STEP = 0.1;

    private final int maxEvaluations;

    ArimaEstimator(int maxEvaluations) {
        if (maxEvaluations < 1) {
            throw new IllegalArgumentException("maxEvaluations must be >= 1, got: " + maxEvaluations);
        }
        this.maxEvaluations = maxEvaluations;
    }

    FittedModel fit(TimeSeries train, ModelOrder order) {
        int p = order.getP();
        int d = order.getD();
        int q = order.getQ();
        double[] y = train.getValues();

        if (y.length <= order.total()) {
            throw new ModelFitException(order, "training length " + y.length
                    + " must exceed p+d+q = " + order.total());
        }
        if (train.missingCount() > 0) {
            throw new ModelFitException(order, "training series '" + train.getName() + "' has "
                    + train.missingCount() + " missing value(s)");
        }

        double[] integrationTail = new double[d];
        double[] w = y;
        for (int k = 0; k < d; k++) {
            integrationTail[k] = w[w.length - 1];
            w = difference(w);
        }
        int innovations = w.length - p;
        if (innovations < 2) {
            throw new ModelFitException(order, "differenced series of length " + w.length
                    + " is too short for " + p + " conditioning row(s)");
        }

        boolean withIntercept = d == 0;
        double[] params = estimate(order, w, withIntercept);

        double mu = withIntercept ? params[0] : 0.0;
        int offset = withIntercept ? 1 : 0;
        double[] phi = Arrays.copyOfRange(params, offset, offset + p);
        double[] theta = Arrays.copyOfRange(params, offset + p, offset + p + q);

        if (!admissible(phi, theta)) {
            throw new ModelFitException(order, "estimate is not stationary or not invertible");
        }
        double[] e = innovations(w, mu, phi, theta);
        double ssr = sumOfSquares(e, p);
        double sigma2 = ssr / innovations;
        if (!Double.isFinite(sigma2) || sigma2 <= 0) {
            throw new ModelFitException(order, "residual variance is not positive and finite: " + sigma2);
        }

        double logLikelihood = -innovations / 2.0 * (Math.log(2 * Math.PI * sigma2) + 1);
        double aic = -2 * logLikelihood + 2 * (params.length + 1);

        if (LOG.isTraceEnabled()) {
            LOG.trace("ARIMA{} on '{}': mu={} phi={} theta={} sigma2={} aic={}", order, train.getName(), mu,
                    Arrays.toString(phi), Arrays.toString(theta), sigma2, aic);
        }

        return new FittedModel(order, train.getName(), train.getEnd(), train.getStep(), y.length,
                mu, phi, theta, sigma2, logLikelihood, aic,
                Arrays.copyOfRange(w, w.length - p, w.length),
                Arrays.copyOfRange(e, e.length - q, e.length),
                integrationTail);
    }

    // ---------------------------------------------------------------
    // Estimation
    // ---------------------------------------------------------------

    private double[] estimate(ModelOrder order, double[] w, boolean withIntercept) {
        int p = order.getP();
        int q = order.getQ();
        int k = (withIntercept ? 1 : 0) + p + q;
        if (k == 0) {
            return new double[0];
        }
        double mean = StatUtils.mean(w);
        if (p == 0 && q == 0) {
            // intercept only: the sample mean minimises the sum of squares
            return new double[] {mean};
        }

        double[] start = new double[k];
        double[] steps = new double[k];
        Arrays.fill(steps, COEFFICIENT_STEP);
        if (withIntercept) {
            start[0] = mean;
            double spread = Math.sqrt(StatUtils.variance(w));
            steps[0] = spread > 0 ? 0.1 * spread : COEFFICIENT_STEP;
        }

        ObjectiveFunction objective = new ObjectiveFunction(point -> {
            int offset = withIntercept ? 1 : 0;
            double mu = withIntercept ? point[0] : 0.0;
            double[] phi = Arrays.copyOfRange(point, offset, offset + p);
            double[] theta = Arrays.copyOfRange(point, offset + p, offset + p + q);
            if (!admissible(phi, theta)) {
                return PENALTY;
            }
            double ssr = sumOfSquares(innovations(w, mu, phi, theta), p);
            return Double.isFinite(ssr) ? ssr : PENALTY;
        });

        SimplexOptimizer optimizer = new SimplexOptimizer(new SimpleValueChecker(1e-10, 1e-12));
        try {
            PointValuePair optimum = optimizer.optimize(
                    new MaxEval(maxEvaluations),
                    objective,
                    GoalType.MINIMIZE,
                    new InitialGuess(start),
                    new NelderMeadSimplex(steps));
            LOG.trace("ARIMA{} converged after {} evaluation(s), SSR={}",
                    order, optimizer.getEvaluations(), optimum.getValue());
            return optimum.getPoint();
        } catch (TooManyEvaluationsException e) {
            throw new ModelFitException(order, "optimizer did not converge within "
                    + maxEvaluations + " evaluations", e);
        } catch (MathIllegalStateException | MathArithmeticException | MathIllegalArgumentException e) {
            throw new ModelFitException(order, "optimizer failed: " + e.getMessage(), e);
        }
    }

    private static boolean admissible(double[] phi, double[] theta) {
        double[] arLag = new double[phi.length];
        for (int i = 0; i < phi.length; i++) {
            arLag[i] = -phi[i];
        }
        return Polynomials.rootsOutsideUnitCircle(arLag) && Polynomials.rootsOutsideUnitCircle(theta);
    }

    static double[] innovations(double[] w, double mu, double[] phi, double[] theta) {
        int p = phi.length;
        double[] e = new double[w.length];
        for (int t = p; t < w.length; t++) {
            double predicted = mu;
            for (int i = 1; i <= p; i++) {
                predicted += phi[i - 1] * (w[t - i] - mu);
            }
            for (int j = 1; j <= theta.length && t - j >= 0; j++) {
                predicted += theta[j - 1] * e[t - j];
            }
            e[t] = w[t] - predicted;
        }
        return e;
    }

    private static double sumOfSquares(double[] e, int from) {
        double sum = 0;
        for (int t = from; t < e.length; t++) {
            sum += e[t] * e[t];
        }
        return sum;
    }

    static double[] difference(double[] values) {
        double[] out = new double[values.length - 1];
        for (int i = 1; i < values.length; i++) {
            out[i - 1] = values[i] - values[i - 1];
        }
        return out;
    }
}
