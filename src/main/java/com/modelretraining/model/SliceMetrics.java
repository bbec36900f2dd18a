package com.modelretraining.model;

public record SliceMetrics(double mae, double rmse) {
}
