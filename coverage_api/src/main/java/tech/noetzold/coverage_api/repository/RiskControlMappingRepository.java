package tech.noetzold.coverage_api.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import tech.noetzold.coverage_api.model.RiskControlMapping;

import java.util.Collection;
import java.util.List;

public interface RiskControlMappingRepository extends JpaRepository<RiskControlMapping, Long> {

    List<RiskControlMapping> findByRiskId(String riskId);

    List<RiskControlMapping> findByControlIdIn(Collection<String> controlIds);
}
