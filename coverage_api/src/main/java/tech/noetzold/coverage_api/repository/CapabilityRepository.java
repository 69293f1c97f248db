package tech.noetzold.coverage_api.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import tech.noetzold.coverage_api.model.Capability;

import java.util.List;

public interface CapabilityRepository extends JpaRepository<Capability, String> {

    List<Capability> findAllByOrderByCapabilityIdAsc();

    List<Capability> findByCapabilityTypeOrderByCapabilityIdAsc(String capabilityType);

    List<Capability> findByCapabilityDomainOrderByCapabilityIdAsc(String capabilityDomain);

    List<Capability> findByCapabilityTypeAndCapabilityDomainOrderByCapabilityIdAsc(String capabilityType,
                                                                                   String capabilityDomain);

    List<Capability> findAllByOrderByCapabilityTypeAscCapabilityDomainAscCapabilityNameAsc();
}
