package com.modelretraining.model;

/**
 * Production metrics and raw predictions recorded for one evaluation slice.
 * {@code predictions} may be {@code null} when the baseline was stored without them.
 */
public record BaselineSlice(double mae, double rmse, double[] predictions) {

    public SliceMetrics metrics() {
        return new SliceMetrics(mae, rmse);
    }
}
