package com.modelretraining.service;

import com.modelretraining.model.ResourceSnapshot;

/**
 * Reports the CPU and memory currently free on the host running training jobs.
 */
public interface ResourceProbe {

    ResourceSnapshot snapshot();
}
