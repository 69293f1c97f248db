package tech.noetzold.coverage_api.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.TestPropertySource;
import tech.noetzold.coverage_api.model.Capability;
import tech.noetzold.coverage_api.repository.MappingFixtures;
import tech.noetzold.coverage_api.repository.impl.JpaMappingStore;

import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
@ActiveProfiles("test")
@TestPropertySource(properties = {
        "coverage.api.default-limit=1",
        "coverage.api.max-limit=2"
})
@Import({CapabilityCatalogService.class, JpaMappingStore.class})
@DisplayName("CapabilityCatalogService paging limits")
class CapabilityCatalogLimitTest {

    @Autowired
    private CapabilityCatalogService catalog;

    @Autowired
    private TestEntityManager entityManager;

    @BeforeEach
    void setUp() {
        MappingFixtures.load(entityManager);
    }

    @Test
    @DisplayName("Should apply the configured default limit when none is given")
    void shouldApplyDefaultLimit() {
        assertThat(catalog.list(null, null, null, 0))
                .extracting(Capability::getCapabilityId)
                .containsExactly("CAP1");
    }

    @Test
    @DisplayName("Should cap a requested limit at the configured maximum")
    void shouldCapLimit() {
        assertThat(catalog.list(null, null, 500, 0))
                .extracting(Capability::getCapabilityId)
                .containsExactly("CAP1", "CAP2");
    }

    @Test
    @DisplayName("Should apply the cap after the offset")
    void shouldCapAfterOffset() {
        assertThat(catalog.list(null, null, 500, 1))
                .extracting(Capability::getCapabilityId)
                .containsExactly("CAP2", "CAP3");
    }
}
