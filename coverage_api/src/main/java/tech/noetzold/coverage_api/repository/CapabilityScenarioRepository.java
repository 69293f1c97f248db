package tech.noetzold.coverage_api.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import tech.noetzold.coverage_api.model.CapabilityScenario;

import java.util.List;

public interface CapabilityScenarioRepository extends JpaRepository<CapabilityScenario, Long> {

    List<CapabilityScenario> findByUserIdOrderByIsDefaultDescUpdatedAtDesc(Long userId);

    boolean existsByUserIdAndScenarioName(Long userId, String scenarioName);

    boolean existsByUserIdAndScenarioNameAndScenarioIdNot(Long userId, String scenarioName, Long scenarioId);

    @Modifying(flushAutomatically = true)
    @Query("update CapabilityScenario s set s.isDefault = false where s.userId = :userId and s.isDefault = true")
    int clearDefaults(@Param("userId") Long userId);

    // the kept scenario is excluded so its managed instance does not go stale
    @Modifying(flushAutomatically = true)
    @Query("update CapabilityScenario s set s.isDefault = false "
            + "where s.userId = :userId and s.isDefault = true and s.scenarioId <> :keepScenarioId")
    int clearDefaultsExcept(@Param("userId") Long userId, @Param("keepScenarioId") Long keepScenarioId);
}
