package com.powersentinel.core.ingest;

import com.powersentinel.core.model.TimeSeries;

/**
 * Fills missing values of a regular series.
 *
 * <p>
 * Forward-fill leaves a leading run of missing rows untouched because there
 * is nothing to propagate; backward-fill does the same for a trailing run.
 * </p>
 *
 * @since 1.0.0
 */
public final class Filler {

    private Filler() {
        // utility class — not instantiable
    }

    public static TimeSeries fill(TimeSeries in, FillPolicy policy) {
        return switch (policy) {
            case NONE -> in;
            case FFILL -> forwardFill(in);
            case BFILL -> backwardFill(in);
        };
    }

    public static TimeSeries forwardFill(TimeSeries in) {
        double[] out = in.getValues();
        double last = Double.NaN;
        for (int i = 0; i < out.length; i++) {
            last = Double.isNaN(out[i]) ? last : out[i];
            out[i] = last;
        }
        return in.withValues(out);
    }

    public static TimeSeries backwardFill(TimeSeries in) {
        double[] out = in.getValues();
        double next = Double.NaN;
        for (int i = out.length - 1; i >= 0; --i) {
            next = Double.isNaN(out[i]) ? next : out[i];
            out[i] = next;
        }
        return in.withValues(out);
    }
}
