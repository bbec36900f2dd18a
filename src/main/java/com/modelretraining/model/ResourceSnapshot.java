package com.modelretraining.model;

public record ResourceSnapshot(double freeCpuCores, long freeMemoryMb) {

    public boolean satisfies(ResourceRequirement requirement) {
        return freeCpuCores >= requirement.cpuCores() && freeMemoryMb >= requirement.memoryMb();
    }
}
