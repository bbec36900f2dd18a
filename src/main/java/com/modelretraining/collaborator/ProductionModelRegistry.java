package com.modelretraining.collaborator;

import com.modelretraining.model.ProductionModel;

import java.util.Optional;

public interface ProductionModelRegistry {

    Optional<ProductionModel> loadProductionModel();

    /**
     * Makes the given run/version the model serving live predictions.
     */
    void promote(String runId, String version);
}
