package com.powersentinel.core.forecast;

import com.powersentinel.core.config.ForecastSettings;
import com.powersentinel.core.error.InvalidHorizonException;
import com.powersentinel.core.error.ModelFitException;
import com.powersentinel.core.error.NoViableModelException;
import com.powersentinel.core.error.PowerSentinelException;
import com.powersentinel.core.model.ModelOrder;
import com.powersentinel.core.model.TimeSeries;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * ARIMA order selection, fitting and forecasting.
 *
 * <h3>Grid search</h3>
 * <p>
 * Every (p, d, q) in the cross-product of the candidate lists is fitted and
 * scored by AIC. Candidates that fail to fit ({@link ModelFitException},
 * {@link ArithmeticException}) or exceed the per-trial timeout are skipped
 * rather than aborting the search; any other exception aborts it, whether
 * trials run sequentially or pooled. With {@code searchParallelism > 1} (or a per-trial
 * timeout) trials run on a fixed pool owned by the call; results are reduced
 * in canonical order afterwards, so the winner never depends on completion
 * order and ties go to the candidate enumerated first.
 * </p>
 *
 * <h3>Thread safety</h3>
 * <p>
 * Instances hold only immutable settings and may be shared.
 * </p>
 *
 * @since 1.0.0
 */
public class ForecastEngine {

    private static final Logger LOG = LoggerFactory.getLogger(ForecastEngine.class);

    private final ForecastSettings settings;
    private final ArimaEstimator estimator;

    public ForecastEngine() {
        this(new ForecastSettings());
    }

    /**
     * @throws IllegalStateException if the settings are invalid
     */
    public ForecastEngine(ForecastSettings settings) {
        this(settings, new ArimaEstimator(Objects.requireNonNull(settings, "ForecastSettings must not be null")
                .getMaxEvaluations()));
    }

    ForecastEngine(ForecastSettings settings, ArimaEstimator estimator) {
        this.settings = Objects.requireNonNull(settings, "ForecastSettings must not be null");
        settings.validate();
        this.estimator = Objects.requireNonNull(estimator, "ArimaEstimator must not be null");
    }

    // ---------------------------------------------------------------
    // Grid search
    // ---------------------------------------------------------------

    /**
     * Search the candidate lists configured in the settings.
     */
    public GridSearchResult gridSearch(TimeSeries train) {
        return gridSearch(train, settings.getArOrders(), settings.getDifferencingOrders(), settings.getMaOrders());
    }

    /**
     * @throws NoViableModelException   if every candidate fails
     * @throws IllegalArgumentException if a candidate list is empty or holds
     *                                  a negative order
     */
    public GridSearchResult gridSearch(TimeSeries train, List<Integer> arOrders, List<Integer> differencingOrders,
            List<Integer> maOrders) {
        Objects.requireNonNull(train, "Training series must not be null");
        List<ModelOrder> candidates = enumerate(arOrders, differencingOrders, maOrders);

        int threads = Math.min(settings.getSearchParallelism(), candidates.size());
        LOG.info("Grid search over {} candidate order(s) on '{}' ({} rows, {} thread(s))",
                candidates.size(), train.getName(), train.size(), threads);

        List<CandidateTrial> trials = threads > 1 || settings.getTrialTimeoutSeconds() > 0
                ? runPooled(train, candidates, threads)
                : runSequential(train, candidates);

        CandidateTrial best = null;
        for (CandidateTrial trial : trials) {
            if (!trial.isSkipped() && (best == null || trial.getAic() < best.getAic())) {
                best = trial;
            }
        }
        if (best == null) {
            throw new NoViableModelException(candidates.size());
        }

        GridSearchResult result = new GridSearchResult(best.getOrder(), best.getAic(), trials);
        LOG.info("Best order ARIMA{} with AIC {} ({} of {} candidate(s) skipped)",
                result.getBestOrder(), result.getBestAic(), result.getSkippedCount(), candidates.size());
        return result;
    }

    /**
     * Canonical enumeration: p outermost, then d, then q; duplicates dropped.
     */
    static List<ModelOrder> enumerate(List<Integer> arOrders, List<Integer> differencingOrders,
            List<Integer> maOrders) {
        requireCandidates("arOrders", arOrders);
        requireCandidates("differencingOrders", differencingOrders);
        requireCandidates("maOrders", maOrders);
        Set<ModelOrder> orders = new LinkedHashSet<>();
        for (int p : arOrders) {
            for (int d : differencingOrders) {
                for (int q : maOrders) {
                    orders.add(ModelOrder.of(p, d, q));
                }
            }
        }
        return new ArrayList<>(orders);
    }

    private List<CandidateTrial> runSequential(TimeSeries train, List<ModelOrder> candidates) {
        List<CandidateTrial> trials = new ArrayList<>(candidates.size());
        for (ModelOrder order : candidates) {
            trials.add(evaluate(train, order));
        }
        return trials;
    }

    private List<CandidateTrial> runPooled(TimeSeries train, List<ModelOrder> candidates, int threads) {
        ExecutorService pool = Executors.newFixedThreadPool(Math.max(1, threads), new SearchThreadFactory());
        try {
            List<Future<CandidateTrial>> futures = new ArrayList<>(candidates.size());
            for (ModelOrder order : candidates) {
                futures.add(pool.submit(() -> evaluate(train, order)));
            }

            long timeout = settings.getTrialTimeoutSeconds();
            List<CandidateTrial> trials = new ArrayList<>(candidates.size());
            for (int i = 0; i < futures.size(); i++) {
                Future<CandidateTrial> future = futures.get(i);
                ModelOrder order = candidates.get(i);
                try {
                    trials.add(timeout > 0 ? future.get(timeout, TimeUnit.SECONDS) : future.get());
                } catch (TimeoutException e) {
                    future.cancel(true);
                    LOG.warn("Skipping ARIMA{}: no result within {}s", order, timeout);
                    trials.add(CandidateTrial.skipped(order, "timed out after " + timeout + "s"));
                } catch (ExecutionException e) {
                    // fit failures are already skipped trials; anything else is a defect
                    Throwable cause = e.getCause();
                    if (cause instanceof RuntimeException runtime) {
                        throw runtime;
                    }
                    if (cause instanceof Error error) {
                        throw error;
                    }
                    throw new PowerSentinelException("Grid search failed at ARIMA" + order, cause);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new PowerSentinelException("Grid search interrupted at ARIMA" + order, e);
                }
            }
            return trials;
        } finally {
            pool.shutdownNow();
        }
    }

    private CandidateTrial evaluate(TimeSeries train, ModelOrder order) {
        try {
            FittedModel model = estimator.fit(train, order);
            LOG.debug("ARIMA{} AIC={}", order, model.getAic());
            return CandidateTrial.scored(order, model.getAic());
        } catch (ModelFitException | ArithmeticException e) {
            LOG.warn("Skipping ARIMA{}: {}", order, e.getMessage());
            return CandidateTrial.skipped(order, e.getMessage());
        }
    }

    // ---------------------------------------------------------------
    // Fit / forecast
    // ---------------------------------------------------------------

    /**
     * @throws ModelFitException if the order cannot be fitted to the series
     */
    public FittedModel fit(TimeSeries train, ModelOrder order) {
        Objects.requireNonNull(train, "Training series must not be null");
        Objects.requireNonNull(order, "Order must not be null");
        FittedModel model = estimator.fit(train, order);
        LOG.info("Fitted ARIMA{} on '{}' ({} rows): AIC={}, sigma2={}",
                order, train.getName(), train.size(), model.getAic(), model.sigma2());
        return model;
    }

    /**
     * Forecast {@code horizon} steps past the end of the training series, at
     * the training frequency and under the training series' name.
     *
     * @throws InvalidHorizonException if {@code horizon <= 0}
     */
    public TimeSeries forecast(FittedModel model, int horizon) {
        Objects.requireNonNull(model, "FittedModel must not be null");
        if (horizon <= 0) {
            throw new InvalidHorizonException(horizon);
        }
        double[] values = model.predict(horizon);
        LOG.debug("Forecast {} step(s) of '{}' with ARIMA{}", horizon, model.getSeriesName(), model.getOrder());
        return new TimeSeries(model.getSeriesName(), model.getTrainingEnd().plus(model.getStep()),
                model.getStep(), values);
    }

    public ForecastSettings getSettings() {
        return settings;
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private static void requireCandidates(String name, List<Integer> values) {
        if (values == null || values.isEmpty()) {
            throw new IllegalArgumentException("'" + name + "' must contain at least one candidate");
        }
    }

    private static final class SearchThreadFactory implements ThreadFactory {

        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable task) {
            Thread thread = new Thread(task, "arima-search-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
