package tech.noetzold.coverage_api.repository.impl;

import org.springframework.stereotype.Repository;
import tech.noetzold.coverage_api.model.Capability;
import tech.noetzold.coverage_api.model.CapabilityControlMapping;
import tech.noetzold.coverage_api.model.Control;
import tech.noetzold.coverage_api.model.Risk;
import tech.noetzold.coverage_api.model.RiskControlMapping;
import tech.noetzold.coverage_api.repository.CapabilityControlMappingRepository;
import tech.noetzold.coverage_api.repository.CapabilityRepository;
import tech.noetzold.coverage_api.repository.ControlRepository;
import tech.noetzold.coverage_api.repository.MappingStore;
import tech.noetzold.coverage_api.repository.RiskControlMappingRepository;
import tech.noetzold.coverage_api.repository.RiskRepository;

import java.util.*;
import java.util.function.Function;
import java.util.stream.Collectors;

@Repository
public class JpaMappingStore implements MappingStore {

    private final RiskRepository riskRepo;
    private final ControlRepository controlRepo;
    private final CapabilityRepository capabilityRepo;
    private final CapabilityControlMappingRepository capabilityMappingRepo;
    private final RiskControlMappingRepository riskMappingRepo;

    public JpaMappingStore(RiskRepository riskRepo,
                           ControlRepository controlRepo,
                           CapabilityRepository capabilityRepo,
                           CapabilityControlMappingRepository capabilityMappingRepo,
                           RiskControlMappingRepository riskMappingRepo) {
        this.riskRepo = riskRepo;
        this.controlRepo = controlRepo;
        this.capabilityRepo = capabilityRepo;
        this.capabilityMappingRepo = capabilityMappingRepo;
        this.riskMappingRepo = riskMappingRepo;
    }

    @Override
    public long totalControls() {
        return controlRepo.count();
    }

    @Override
    public long totalRisks() {
        return riskRepo.count();
    }

    @Override
    public Set<String> allRiskIds() {
        return new HashSet<>(riskRepo.findAllRiskIds());
    }

    @Override
    public Set<String> controlsForCapabilities(Collection<String> capabilityIds) {
        Set<String> ids = clean(capabilityIds);
        if (ids.isEmpty()) return new HashSet<>();
        return new HashSet<>(capabilityMappingRepo.findControlIdsByCapabilityIds(ids));
    }

    @Override
    public Set<String> allControlsInAnyCapability() {
        return new HashSet<>(capabilityMappingRepo.findAllMappedControlIds());
    }

    @Override
    public Set<String> requiredControlsForRisk(String riskId) {
        if (riskId == null || riskId.isBlank()) return new HashSet<>();
        return riskMappingRepo.findByRiskId(riskId).stream()
                .map(RiskControlMapping::getControlId)
                .collect(Collectors.toCollection(HashSet::new));
    }

    @Override
    public Map<String, Set<String>> requiredControlsByRisk() {
        Map<String, Set<String>> byRisk = new HashMap<>();
        for (RiskControlMapping m : riskMappingRepo.findAll()) {
            byRisk.computeIfAbsent(m.getRiskId(), k -> new HashSet<>()).add(m.getControlId());
        }
        return byRisk;
    }

    @Override
    public Map<String, Risk> risksById(Collection<String> riskIds) {
        Set<String> ids = clean(riskIds);
        if (ids.isEmpty()) return new HashMap<>();
        return riskRepo.findAllById(ids).stream()
                .collect(Collectors.toMap(Risk::getRiskId, Function.identity(), (a, b) -> a));
    }

    @Override
    public Map<String, Control> controlsById(Collection<String> controlIds) {
        Set<String> ids = clean(controlIds);
        if (ids.isEmpty()) return new HashMap<>();
        return controlRepo.findAllById(ids).stream()
                .collect(Collectors.toMap(Control::getControlId, Function.identity(), (a, b) -> a));
    }

    @Override
    public Map<String, List<String>> capabilityNamesForControls(Collection<String> controlIds) {
        Set<String> ids = clean(controlIds);
        if (ids.isEmpty()) return new HashMap<>();

        List<CapabilityControlMapping> mappings = capabilityMappingRepo.findByControlIdIn(ids);
        Set<String> capabilityIds = mappings.stream()
                .map(CapabilityControlMapping::getCapabilityId)
                .collect(Collectors.toSet());
        Map<String, String> names = capabilityRepo.findAllById(capabilityIds).stream()
                .collect(Collectors.toMap(Capability::getCapabilityId, Capability::getCapabilityName, (a, b) -> a));

        Map<String, List<String>> result = new HashMap<>();
        for (CapabilityControlMapping m : mappings) {
            String name = names.get(m.getCapabilityId());
            // mapping rows can point at capabilities the ETL never loaded
            if (name == null) continue;
            List<String> forControl = result.computeIfAbsent(m.getControlId(), k -> new ArrayList<>());
            if (!forControl.contains(name)) forControl.add(name);
        }
        result.values().forEach(Collections::sort);
        return result;
    }

    private static Set<String> clean(Collection<String> ids) {
        if (ids == null) return new HashSet<>();
        return ids.stream()
                .filter(Objects::nonNull)
                .collect(Collectors.toCollection(HashSet::new));
    }
}
