package com.modelretraining.model;

import java.util.Objects;

/**
 * A named evaluation dataset: one feature row per target value.
 */
public record EvaluationSlice(String name, double[][] features, double[] targets) {

    public static final String HOLDOUT = "holdout";
    public static final String RECENT = "recent";

    public EvaluationSlice {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(features, "features");
        Objects.requireNonNull(targets, "targets");
        if (features.length != targets.length) {
            throw new IllegalArgumentException("slice '" + name + "' has " + features.length
                + " feature rows but " + targets.length + " targets");
        }
    }

    public int size() {
        return targets.length;
    }
}
