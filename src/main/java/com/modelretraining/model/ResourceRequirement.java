package com.modelretraining.model;

public record ResourceRequirement(int cpuCores, long memoryMb) {

    public ResourceRequirement {
        if (cpuCores < 0 || memoryMb < 0) {
            throw new IllegalArgumentException("resource requirement must not be negative");
        }
    }
}
