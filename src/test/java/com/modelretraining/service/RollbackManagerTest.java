package com.modelretraining.service;

import com.modelretraining.collaborator.ProductionModelRegistry;
import com.modelretraining.config.RetrainingSettingsFactory;
import com.modelretraining.entity.StableModelRecord;
import com.modelretraining.exception.MlPlatformUnavailableException;
import com.modelretraining.repository.StableModelRepository;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;

import java.net.ConnectException;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@DataJpaTest
@Import({RollbackManager.class, RetrainingSettingsFactory.class})
class RollbackManagerTest {

    @Autowired RollbackManager rollbackManager;
    @Autowired StableModelRepository repository;
    @MockBean ProductionModelRegistry registry;

    @Test
    void registerStable_thenGet_returnsRecord() {
        rollbackManager.registerStable("run123", "2");

        Optional<StableModelRecord> stable = rollbackManager.getStable();
        assertThat(stable).isPresent();
        assertThat(stable.get().getRunId()).isEqualTo("run123");
        assertThat(stable.get().getVersion()).isEqualTo("2");
        assertThat(stable.get().getRecordedAt()).isNotNull();
    }

    @Test
    void registerStable_twice_overwritesSingleRecord() {
        rollbackManager.registerStable("run123", "2");
        rollbackManager.registerStable("run456", "3");

        assertThat(repository.count()).isEqualTo(1);
        StableModelRecord stable = rollbackManager.getStable().orElseThrow();
        assertThat(stable.getRunId()).isEqualTo("run456");
        assertThat(stable.getVersion()).isEqualTo("3");
    }

    @Test
    void attemptRollback_noStableModel_returnsFalse() {
        assertThat(rollbackManager.attemptRollback("validation_failed")).isFalse();
        verifyNoInteractions(registry);
    }

    @Test
    void attemptRollback_repromotesStableModel() {
        rollbackManager.registerStable("run123", "2");

        assertThat(rollbackManager.attemptRollback("comparison_rejected")).isTrue();
        verify(registry).promote("run123", "2");
    }

    @Test
    void attemptRollback_registryFails_returnsFalse() {
        rollbackManager.registerStable("run123", "2");
        doThrow(new MlPlatformUnavailableException(new ConnectException("refused")))
            .when(registry).promote(anyString(), anyString());

        assertThat(rollbackManager.attemptRollback("deployment_failed")).isFalse();
    }
}
