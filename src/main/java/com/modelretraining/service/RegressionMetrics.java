package com.modelretraining.service;

import com.modelretraining.model.SliceMetrics;

final class RegressionMetrics {

    private RegressionMetrics() {
    }

    static SliceMetrics of(double[] actual, double[] predicted) {
        if (actual.length != predicted.length) {
            throw new IllegalArgumentException("length mismatch: " + actual.length + " targets vs "
                + predicted.length + " predictions");
        }
        if (actual.length == 0) {
            throw new IllegalArgumentException("cannot compute metrics on an empty slice");
        }
        double absError = 0.0;
        double sqError = 0.0;
        for (int i = 0; i < actual.length; i++) {
            double err = predicted[i] - actual[i];
            absError += Math.abs(err);
            sqError += err * err;
        }
        double n = actual.length;
        return new SliceMetrics(absError / n, Math.sqrt(sqError / n));
    }

    static double round(double value) {
        return Math.round(value * 10000.0) / 10000.0;
    }
}
