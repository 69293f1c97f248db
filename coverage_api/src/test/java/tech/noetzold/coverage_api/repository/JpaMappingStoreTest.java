package tech.noetzold.coverage_api.repository;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;
import tech.noetzold.coverage_api.model.*;
import tech.noetzold.coverage_api.repository.impl.JpaMappingStore;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
@ActiveProfiles("test")
@Import(JpaMappingStore.class)
@DisplayName("JpaMappingStore Integration Tests")
class JpaMappingStoreTest {

    @Autowired
    private TestEntityManager entityManager;

    @Autowired
    private MappingStore store;

    @BeforeEach
    void setUp() {
        MappingFixtures.load(entityManager);
    }

    @Test
    @DisplayName("Should count risks and controls")
    void shouldCountRows() {
        assertThat(store.totalRisks()).isEqualTo(3);
        assertThat(store.totalControls()).isEqualTo(4);
        assertThat(store.allRiskIds()).containsExactlyInAnyOrder("R1", "R2", "R3");
    }

    @Test
    @DisplayName("Should resolve controls of the given capabilities")
    void shouldResolveCapabilityControls() {
        assertThat(store.controlsForCapabilities(List.of("CAP1"))).containsExactly("C1");
        assertThat(store.controlsForCapabilities(List.of("CAP1", "CAP2"))).containsExactlyInAnyOrder("C1", "C2", "C3");
        assertThat(store.allControlsInAnyCapability()).containsExactlyInAnyOrder("C1", "C2", "C3");
    }

    @Test
    @DisplayName("Should return empty sets for unknown or missing ids")
    void shouldDegradeForUnknownIds() {
        assertThat(store.controlsForCapabilities(List.of("NOPE"))).isEmpty();
        assertThat(store.controlsForCapabilities(List.of())).isEmpty();
        assertThat(store.controlsForCapabilities(null)).isEmpty();
        assertThat(store.requiredControlsForRisk("NOPE")).isEmpty();
        assertThat(store.requiredControlsForRisk(null)).isEmpty();
        assertThat(store.risksById(List.of("NOPE"))).isEmpty();
        assertThat(store.controlsById(List.of())).isEmpty();
        assertThat(store.capabilityNamesForControls(List.of("C4"))).isEmpty();
    }

    @Test
    @DisplayName("Should resolve required controls per risk")
    void shouldResolveRequiredControls() {
        assertThat(store.requiredControlsForRisk("R1")).containsExactlyInAnyOrder("C1", "C2");
        assertThat(store.requiredControlsForRisk("R3")).isEmpty();

        Map<String, Set<String>> byRisk = store.requiredControlsByRisk();
        assertThat(byRisk).containsOnlyKeys("R1", "R2");
        assertThat(byRisk.get("R2")).containsExactly("C3");
    }

    @Test
    @DisplayName("Should list capability names for controls")
    void shouldListCapabilityNames() {
        Map<String, List<String>> names = store.capabilityNamesForControls(List.of("C1", "C3"));

        assertThat(names.get("C1")).containsExactly("Key Management");
        assertThat(names.get("C3")).containsExactly("Monitoring");
    }

    @Test
    @DisplayName("Should look up display rows by id")
    void shouldLookUpDisplayRows() {
        Map<String, Risk> risks = store.risksById(List.of("R1", "R9"));
        Map<String, Control> controls = store.controlsById(List.of("C2"));

        assertThat(risks).containsOnlyKeys("R1");
        assertThat(risks.get("R1").getRiskTitle()).isEqualTo("Data leak");
        assertThat(controls.get("C2").getControlDescription()).isEqualTo("Rotate keys");
    }
}
