package com.powersentinel.core.feature;

import com.powersentinel.core.model.TimeSeries;

/**
 * Result of {@link SeasonalDecomposer#decompose}: observed series plus its
 * trend, seasonal and residual components, all on the observed grid.
 *
 * @since 1.0.0
 */
public final class Decomposition {

    private final DecompositionModel model;
    private final int period;
    private final TimeSeries observed;
    private final TimeSeries trend;
    private final TimeSeries seasonal;
    private final TimeSeries residual;

    Decomposition(DecompositionModel model, int period, TimeSeries observed, TimeSeries trend,
            TimeSeries seasonal, TimeSeries residual) {
        this.model = model;
        this.period = period;
        this.observed = observed;
        this.trend = trend;
        this.seasonal = seasonal;
        this.residual = residual;
    }

    public DecompositionModel getModel() {
        return model;
    }

    public int getPeriod() {
        return period;
    }

    public TimeSeries getObserved() {
        return observed;
    }

    /** Centred moving average; {@code NaN} for the first and last half-period. */
    public TimeSeries getTrend() {
        return trend;
    }

    public TimeSeries getSeasonal() {
        return seasonal;
    }

    public TimeSeries getResidual() {
        return residual;
    }

    @Override
    public String toString() {
        return "Decomposition{model=" + model + ", period=" + period + ", observed=" + observed.getName()
                + ", size=" + observed.size() + '}';
    }
}
