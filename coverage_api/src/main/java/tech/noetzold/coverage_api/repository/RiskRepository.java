package tech.noetzold.coverage_api.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import tech.noetzold.coverage_api.model.Risk;

import java.util.Set;

public interface RiskRepository extends JpaRepository<Risk, String> {

    @Query("select r.riskId from Risk r")
    Set<String> findAllRiskIds();
}
