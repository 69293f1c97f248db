package tech.noetzold.coverage_api.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import tech.noetzold.coverage_api.model.ControlSelection;

import java.util.List;

public interface ControlSelectionRepository extends JpaRepository<ControlSelection, Long> {

    List<ControlSelection> findByScenarioId(Long scenarioId);

    @Modifying(flushAutomatically = true)
    @Query("delete from ControlSelection s where s.scenarioId = :scenarioId")
    int deleteAllForScenario(@Param("scenarioId") Long scenarioId);
}
