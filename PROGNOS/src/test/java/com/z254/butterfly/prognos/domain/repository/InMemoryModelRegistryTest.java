package com.z254.butterfly.prognos.domain.repository;

import com.z254.butterfly.prognos.EngineFixtures;
import com.z254.butterfly.prognos.domain.model.ModelConfig;
import com.z254.butterfly.prognos.domain.model.ModelKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class InMemoryModelRegistryTest {

    private InMemoryModelRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new InMemoryModelRegistry();
    }

    @Test
    @DisplayName("lists models in registration order, replacements keep their slot")
    void keepsRegistrationOrder() {
        registry.upsert(EngineFixtures.model("b", ModelKind.TIME_SERIES, 0.8));
        registry.upsert(EngineFixtures.model("a", ModelKind.REGRESSION, 0.8));
        registry.upsert(EngineFixtures.model("b", ModelKind.TIME_SERIES, 0.9));

        assertThat(registry.list()).extracting(ModelConfig::getModelId).containsExactly("b", "a");
        assertThat(registry.get("b")).get()
                .extracting(config -> config.getPerformance().getAccuracy())
                .isEqualTo(0.9);
    }

    @Test
    void listActiveSkipsDeactivatedModels() {
        registry.upsert(EngineFixtures.model("a", ModelKind.REGRESSION, 0.8));
        registry.upsert(EngineFixtures.model("b", ModelKind.ANOMALY, 0.8).toBuilder().active(false).build());

        assertThat(registry.listActive()).extracting(ModelConfig::getModelId).containsExactly("a");
    }

    @Test
    @DisplayName("update swaps in a new value and bumps the version")
    void updateBumpsVersion() {
        ModelConfig original = registry.upsert(EngineFixtures.model("a", ModelKind.REGRESSION, 0.8));

        ModelConfig updated = registry.update("a", current -> current.toBuilder().active(false).build()).orElseThrow();

        assertThat(updated.getVersion()).isEqualTo(original.getVersion() + 1);
        assertThat(updated.isActive()).isFalse();
        assertThat(original.isActive()).isTrue();
        assertThat(registry.get("a")).contains(updated);
    }

    @Test
    void updateOfUnknownModelIsEmpty() {
        assertThat(registry.update("missing", current -> current)).isEmpty();
        assertThat(registry.get("missing")).isEmpty();
    }
}
