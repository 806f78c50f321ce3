package com.powersentinel.core.ingest;

import com.powersentinel.core.model.RawReading;
import com.powersentinel.core.model.TimeSeries;

import java.time.Duration;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Places readings on a regular grid by bucket mean.
 *
 * <p>
 * Buckets are aligned to the epoch in multiples of the step, so hourly
 * buckets start on the hour. The value of a bucket is the mean of its
 * defined readings; a bucket without any defined reading is missing.
 * Downsampling therefore changes both the number of rows and their values.
 * Upsampling leaves the new rows missing.
 * </p>
 *
 * @since 1.0.0
 */
public final class Resampler {

    private Resampler() {
        // utility class — not instantiable
    }

    /**
     * Resample a regular series to another step. A series already at the
     * requested step is returned unchanged.
     */
    public static TimeSeries resample(TimeSeries in, Duration step) {
        Objects.requireNonNull(in, "Series must not be null");
        Objects.requireNonNull(step, "Step must not be null");
        if (in.getStep().equals(step) || in.isEmpty()) {
            return in;
        }
        List<RawReading> readings = new ArrayList<>(in.size());
        for (int i = 0; i < in.size(); i++) {
            readings.add(new RawReading(in.timestampAt(i), in.valueAt(i)));
        }
        return resample(readings, in.getName(), step);
    }

    /**
     * Build a regular series covering the first to the last bucket touched by
     * {@code readings}. Input order does not matter.
     *
     * @throws IllegalArgumentException if {@code readings} is empty or the
     *                                  step is not a whole number of seconds
     */
    public static TimeSeries resample(List<RawReading> readings, String name, Duration step) {
        Objects.requireNonNull(readings, "Readings must not be null");
        if (readings.isEmpty()) {
            throw new IllegalArgumentException("Cannot resample an empty reading list");
        }
        long stepSeconds = step.getSeconds();
        if (stepSeconds <= 0 || step.getNano() != 0) {
            throw new IllegalArgumentException("Resampling step must be a positive whole number of seconds, got: " + step);
        }

        long firstBucket = Long.MAX_VALUE;
        long lastBucket = Long.MIN_VALUE;
        for (RawReading r : readings) {
            long bucket = bucketOf(r.getTimestamp(), stepSeconds);
            firstBucket = Math.min(firstBucket, bucket);
            lastBucket = Math.max(lastBucket, bucket);
        }

        long span = (lastBucket - firstBucket) / stepSeconds + 1;
        if (span > Integer.MAX_VALUE - 8) {
            throw new IllegalArgumentException("Resampled grid too large: " + span + " rows");
        }
        int rows = (int) span;
        double[] sums = new double[rows];
        int[] counts = new int[rows];
        for (RawReading r : readings) {
            if (r.isMissing()) {
                continue;
            }
            int row = (int) ((bucketOf(r.getTimestamp(), stepSeconds) - firstBucket) / stepSeconds);
            sums[row] += r.getValue();
            counts[row]++;
        }

        double[] values = new double[rows];
        for (int i = 0; i < rows; i++) {
            values[i] = counts[i] > 0 ? sums[i] / counts[i] : Double.NaN;
        }
        LocalDateTime start = LocalDateTime.ofEpochSecond(firstBucket, 0, ZoneOffset.UTC);
        return new TimeSeries(name, start, step, values);
    }

    private static long bucketOf(LocalDateTime timestamp, long stepSeconds) {
        long epochSeconds = timestamp.toEpochSecond(ZoneOffset.UTC);
        return Math.floorDiv(epochSeconds, stepSeconds) * stepSeconds;
    }
}
