package tech.noetzold.coverage_api.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;
import tech.noetzold.coverage_api.exception.CoverageApiException;
import tech.noetzold.coverage_api.exception.ErrorKind;
import tech.noetzold.coverage_api.model.*;
import tech.noetzold.coverage_api.repository.MappingFixtures;
import tech.noetzold.coverage_api.repository.impl.JpaMappingStore;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DataJpaTest
@ActiveProfiles("test")
@Import({CapabilityCatalogService.class, JpaMappingStore.class})
@DisplayName("CapabilityCatalogService Integration Tests")
class CapabilityCatalogServiceTest {

    @Autowired
    private CapabilityCatalogService catalog;

    @Autowired
    private TestEntityManager entityManager;

    @BeforeEach
    void setUp() {
        MappingFixtures.load(entityManager);
    }

    @Test
    @DisplayName("Should list capabilities ordered by id")
    void shouldListAll() {
        assertThat(catalog.list(null, null, null, 0))
                .extracting(Capability::getCapabilityId)
                .containsExactly("CAP1", "CAP2", "CAP3");
    }

    @Test
    @DisplayName("Should filter by type and domain")
    void shouldFilter() {
        assertThat(catalog.list("technical", null, null, 0))
                .extracting(Capability::getCapabilityId).containsExactly("CAP1", "CAP2");
        assertThat(catalog.list(null, "Security", null, 0))
                .extracting(Capability::getCapabilityId).containsExactly("CAP1", "CAP3");
        assertThat(catalog.list("non-technical", "Security", null, 0))
                .extracting(Capability::getCapabilityId).containsExactly("CAP3");
    }

    @Test
    @DisplayName("Should page with limit and offset")
    void shouldPage() {
        assertThat(catalog.list(null, null, 1, 1))
                .extracting(Capability::getCapabilityId).containsExactly("CAP2");
        assertThat(catalog.list(null, null, 10, 5)).isEmpty();
    }

    @Test
    @DisplayName("Should reject a non-positive limit or negative offset")
    void shouldRejectBadPaging() {
        assertThatThrownBy(() -> catalog.list(null, null, 0, 0))
                .isInstanceOf(CoverageApiException.class)
                .extracting("kind").isEqualTo(ErrorKind.VALIDATION_ERROR);
        assertThatThrownBy(() -> catalog.list(null, null, null, -1))
                .isInstanceOf(CoverageApiException.class)
                .extracting("kind").isEqualTo(ErrorKind.VALIDATION_ERROR);
    }

    @Test
    @DisplayName("Should fail with NOT_FOUND for an unknown capability")
    void shouldFailForUnknownCapability() {
        assertThat(catalog.get("CAP2").getCapabilityName()).isEqualTo("Monitoring");
        assertThatThrownBy(() -> catalog.get("CAP9"))
                .isInstanceOf(CoverageApiException.class)
                .extracting("kind").isEqualTo(ErrorKind.NOT_FOUND);
    }

    @Test
    @DisplayName("Should describe a risk with its mitigating controls ordered by id")
    void shouldDescribeRisk() {
        RiskDetailResponse r1 = catalog.riskDetail("R1");

        assertThat(r1.risk()).isEqualTo(new RiskDetailResponse.RiskSummary("R1", "Data leak", "Data leak description"));
        assertThat(r1.associatedControls())
                .extracting(RiskDetailResponse.ControlSummary::id)
                .containsExactly("C1", "C2");
        assertThat(r1.associatedControls().get(0).domain()).isEqualTo("Protect");
        assertThat(catalog.riskDetail("R3").associatedControls()).isEmpty();
        assertThatThrownBy(() -> catalog.riskDetail("R404"))
                .isInstanceOf(CoverageApiException.class)
                .hasMessageContaining("R404")
                .extracting("kind").isEqualTo(ErrorKind.NOT_FOUND);
    }

    @Test
    @DisplayName("Should skip mapped controls missing from the controls table")
    void shouldSkipUnloadedControlsInRiskDetail() {
        entityManager.persist(MappingFixtures.riskMapping("R2", "C99"));
        entityManager.flush();

        assertThat(catalog.riskDetail("R2").associatedControls())
                .extracting(RiskDetailResponse.ControlSummary::id)
                .containsExactly("C3");
    }

    @Test
    @DisplayName("Should describe a control with the risks it mitigates")
    void shouldDescribeControl() {
        entityManager.persist(MappingFixtures.riskMapping("R2", "C1"));
        entityManager.flush();

        ControlDetailResponse c1 = catalog.controlDetail("C1");

        assertThat(c1.control().id()).isEqualTo("C1");
        assertThat(c1.control().description()).isEqualTo("Encrypt data at rest");
        assertThat(c1.associatedRisks())
                .extracting(RiskDetailResponse.RiskSummary::id)
                .containsExactly("R1", "R2");
        assertThat(catalog.controlDetail("C4").associatedRisks()).isEmpty();
        assertThatThrownBy(() -> catalog.controlDetail("C404"))
                .isInstanceOf(CoverageApiException.class)
                .hasMessage("Control not found: C404")
                .extracting("kind").isEqualTo(ErrorKind.NOT_FOUND);
    }

    @Test
    @DisplayName("Should list controls mapped to any capability")
    void shouldListMappedControls() {
        assertThat(catalog.mappedControlIds()).containsExactly("C1", "C2", "C3");
    }

    @Test
    @DisplayName("Should build the capability tree with controls and mitigated risks")
    void shouldBuildTree() {
        List<CapabilityTreeNode> tree = catalog.tree();

        // type, then domain, then name
        assertThat(tree).extracting(CapabilityTreeNode::capabilityId).containsExactly("CAP3", "CAP2", "CAP1");

        CapabilityTreeNode governance = tree.get(0);
        assertThat(governance.controls()).isEmpty();
        assertThat(governance.risks()).isEmpty();

        CapabilityTreeNode monitoring = tree.get(1);
        assertThat(monitoring.controls())
                .extracting(CapabilityTreeNode.TreeControl::controlId)
                .containsExactlyInAnyOrder("C2", "C3");
        assertThat(monitoring.risks())
                .extracting(CapabilityTreeNode.TreeRisk::riskId)
                .containsExactlyInAnyOrder("R1", "R2");

        CapabilityTreeNode keys = tree.get(2);
        assertThat(keys.controls()).containsExactly(new CapabilityTreeNode.TreeControl("C1", "C1 title", "Protect"));
        assertThat(keys.risks()).containsExactly(new CapabilityTreeNode.TreeRisk("R1", "Data leak"));
    }

    @Test
    @DisplayName("Should fall back to the control id when the control row is missing")
    void shouldFallBackToControlId() {
        entityManager.persist(MappingFixtures.capabilityMapping("CAP3", "C99"));
        entityManager.flush();

        CapabilityTreeNode governance = catalog.tree().get(0);

        assertThat(governance.controls()).containsExactly(new CapabilityTreeNode.TreeControl("C99", "C99", ""));
    }

    @Test
    @DisplayName("Should report capabilities owning controls no other capability maps")
    void shouldFindUniqueControls() {
        entityManager.persist(MappingFixtures.capabilityMapping("CAP3", "C1"));
        entityManager.flush();

        UniqueControlsResponse unique = catalog.uniqueControls();

        // C1 is now shared between CAP1 and CAP3
        assertThat(unique.capabilitiesWithUniqueControls()).containsExactly("CAP2");
        assertThat(unique.count()).isEqualTo(1);
        assertThat(unique.uniqueControlCounts()).containsEntry("CAP2", 2);
        assertThat(unique.uniqueControlIds().get("CAP2")).containsExactly("C2", "C3");
    }
}
