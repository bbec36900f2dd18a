package com.modelretraining.collaborator;

import com.modelretraining.model.ReadinessReport;

public interface DataReadinessChecker {

    ReadinessReport checkLatestData();
}
