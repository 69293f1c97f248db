package tech.noetzold.coverage_api.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import tech.noetzold.coverage_api.model.CapabilityControlMapping;

import java.util.Collection;
import java.util.List;
import java.util.Set;

public interface CapabilityControlMappingRepository extends JpaRepository<CapabilityControlMapping, Long> {

    @Query("select distinct m.controlId from CapabilityControlMapping m")
    Set<String> findAllMappedControlIds();

    @Query("select distinct m.controlId from CapabilityControlMapping m where m.capabilityId in :capabilityIds")
    Set<String> findControlIdsByCapabilityIds(@Param("capabilityIds") Collection<String> capabilityIds);

    List<CapabilityControlMapping> findByControlIdIn(Collection<String> controlIds);
}
