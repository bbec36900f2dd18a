package com.modelretraining.model;

@FunctionalInterface
public interface TrainingTask {

    void run() throws Exception;
}
