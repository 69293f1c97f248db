package tech.noetzold.coverage_api.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import tech.noetzold.coverage_api.model.CapabilitySelection;

import java.util.List;

public interface CapabilitySelectionRepository extends JpaRepository<CapabilitySelection, Long> {

    List<CapabilitySelection> findByScenarioId(Long scenarioId);

    @Modifying(flushAutomatically = true)
    @Query("delete from CapabilitySelection s where s.scenarioId = :scenarioId")
    int deleteAllForScenario(@Param("scenarioId") Long scenarioId);
}
