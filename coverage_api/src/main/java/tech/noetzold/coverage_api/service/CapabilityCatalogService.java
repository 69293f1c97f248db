package tech.noetzold.coverage_api.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import tech.noetzold.coverage_api.exception.CoverageApiException;
import tech.noetzold.coverage_api.model.*;
import tech.noetzold.coverage_api.repository.CapabilityControlMappingRepository;
import tech.noetzold.coverage_api.repository.CapabilityRepository;
import tech.noetzold.coverage_api.repository.MappingStore;
import tech.noetzold.coverage_api.repository.RiskControlMappingRepository;

import java.util.*;
import java.util.stream.Collectors;

@Slf4j
@Service
@Transactional(readOnly = true)
public class CapabilityCatalogService {

    private final CapabilityRepository capabilityRepo;
    private final CapabilityControlMappingRepository capabilityMappingRepo;
    private final RiskControlMappingRepository riskMappingRepo;
    private final MappingStore store;

    @Value("${coverage.api.default-limit:100}")
    private int defaultLimit;

    @Value("${coverage.api.max-limit:1000}")
    private int maxLimit;

    public CapabilityCatalogService(CapabilityRepository capabilityRepo,
                                    CapabilityControlMappingRepository capabilityMappingRepo,
                                    RiskControlMappingRepository riskMappingRepo,
                                    MappingStore store) {
        this.capabilityRepo = capabilityRepo;
        this.capabilityMappingRepo = capabilityMappingRepo;
        this.riskMappingRepo = riskMappingRepo;
        this.store = store;
    }

    public List<Capability> list(String capabilityType, String domain, Integer limit, int offset) {
        if (limit != null && limit < 1) {
            throw CoverageApiException.validation("limit", "must be at least 1");
        }
        if (offset < 0) {
            throw CoverageApiException.validation("offset", "must not be negative");
        }
        int effectiveLimit = Math.min(limit != null ? limit : defaultLimit, maxLimit);

        boolean byType = capabilityType != null && !capabilityType.isBlank();
        boolean byDomain = domain != null && !domain.isBlank();
        List<Capability> filtered;
        if (byType && byDomain) {
            filtered = capabilityRepo.findByCapabilityTypeAndCapabilityDomainOrderByCapabilityIdAsc(capabilityType, domain);
        } else if (byType) {
            filtered = capabilityRepo.findByCapabilityTypeOrderByCapabilityIdAsc(capabilityType);
        } else if (byDomain) {
            filtered = capabilityRepo.findByCapabilityDomainOrderByCapabilityIdAsc(domain);
        } else {
            filtered = capabilityRepo.findAllByOrderByCapabilityIdAsc();
        }

        return filtered.stream()
                .skip(offset)
                .limit(effectiveLimit)
                .toList();
    }

    public Capability get(String capabilityId) {
        return capabilityRepo.findById(capabilityId)
                .orElseThrow(() -> CoverageApiException.notFound("Capability", capabilityId));
    }

    public RiskDetailResponse riskDetail(String riskId) {
        Risk risk = store.risksById(List.of(riskId)).get(riskId);
        if (risk == null) {
            throw CoverageApiException.notFound("Risk", riskId);
        }
        // mappings to controls the ETL never loaded are dropped
        List<RiskDetailResponse.ControlSummary> controls = store.controlsById(store.requiredControlsForRisk(riskId))
                .values().stream()
                .sorted(Comparator.comparing(Control::getControlId))
                .map(RiskDetailResponse.ControlSummary::fromEntity)
                .toList();
        return new RiskDetailResponse(RiskDetailResponse.RiskSummary.fromEntity(risk), controls);
    }

    public ControlDetailResponse controlDetail(String controlId) {
        Control control = store.controlsById(List.of(controlId)).get(controlId);
        if (control == null) {
            throw CoverageApiException.notFound("Control", controlId);
        }
        Set<String> riskIds = riskMappingRepo.findByControlIdIn(List.of(controlId)).stream()
                .map(RiskControlMapping::getRiskId)
                .collect(Collectors.toSet());
        List<RiskDetailResponse.RiskSummary> risks = store.risksById(riskIds).values().stream()
                .sorted(Comparator.comparing(Risk::getRiskId))
                .map(RiskDetailResponse.RiskSummary::fromEntity)
                .toList();
        return new ControlDetailResponse(ControlDetailResponse.ControlInfo.fromEntity(control), risks);
    }

    public List<String> mappedControlIds() {
        return store.allControlsInAnyCapability().stream().sorted().toList();
    }

    /**
     * Every capability with its mapped controls and the risks those controls
     * mitigate. Controls missing from the controls table keep their id as title.
     */
    public List<CapabilityTreeNode> tree() {
        List<Capability> capabilities = capabilityRepo.findAllByOrderByCapabilityTypeAscCapabilityDomainAscCapabilityNameAsc();

        Map<String, List<String>> controlsByCapability = new HashMap<>();
        for (CapabilityControlMapping m : capabilityMappingRepo.findAll()) {
            List<String> ids = controlsByCapability.computeIfAbsent(m.getCapabilityId(), k -> new ArrayList<>());
            if (!ids.contains(m.getControlId())) ids.add(m.getControlId());
        }
        Set<String> allControlIds = controlsByCapability.values().stream()
                .flatMap(List::stream)
                .collect(Collectors.toSet());

        Map<String, Control> controls = store.controlsById(allControlIds);

        Map<String, List<String>> risksByControl = new HashMap<>();
        Set<String> riskIds = new HashSet<>();
        if (!allControlIds.isEmpty()) {
            for (RiskControlMapping m : riskMappingRepo.findByControlIdIn(allControlIds)) {
                risksByControl.computeIfAbsent(m.getControlId(), k -> new ArrayList<>()).add(m.getRiskId());
                riskIds.add(m.getRiskId());
            }
        }
        Map<String, Risk> risks = store.risksById(riskIds);

        List<CapabilityTreeNode> nodes = new ArrayList<>(capabilities.size());
        for (Capability cap : capabilities) {
            List<String> controlIds = controlsByCapability.getOrDefault(cap.getCapabilityId(), List.of());

            List<CapabilityTreeNode.TreeControl> treeControls = new ArrayList<>();
            Map<String, CapabilityTreeNode.TreeRisk> treeRisks = new LinkedHashMap<>();
            for (String controlId : controlIds) {
                Control c = controls.get(controlId);
                treeControls.add(new CapabilityTreeNode.TreeControl(
                        controlId,
                        c != null && c.getControlTitle() != null ? c.getControlTitle() : controlId,
                        c != null && c.getSecurityFunction() != null ? c.getSecurityFunction() : ""));

                for (String riskId : risksByControl.getOrDefault(controlId, List.of())) {
                    Risk r = risks.get(riskId);
                    // mappings to risks the ETL never loaded are skipped
                    if (r == null) continue;
                    treeRisks.putIfAbsent(riskId, new CapabilityTreeNode.TreeRisk(riskId, r.getRiskTitle()));
                }
            }

            if (treeControls.isEmpty() && "non-technical".equals(cap.getCapabilityType())) {
                log.debug("Non-technical capability {} ({}) has no mapped controls", cap.getCapabilityId(), cap.getCapabilityName());
            }

            nodes.add(new CapabilityTreeNode(
                    cap.getCapabilityId(),
                    cap.getCapabilityName(),
                    cap.getCapabilityType(),
                    cap.getCapabilityDomain(),
                    cap.getCapabilityDefinition(),
                    treeControls,
                    new ArrayList<>(treeRisks.values())));
        }

        log.info("Returning {} capability trees", nodes.size());
        if (nodes.isEmpty()) {
            log.warn("No capabilities loaded; the ETL may not have run yet");
        }
        return nodes;
    }

    /**
     * Capabilities owning at least one control that no other capability maps.
     */
    public UniqueControlsResponse uniqueControls() {
        Map<String, Set<String>> capabilitiesByControl = new HashMap<>();
        for (CapabilityControlMapping m : capabilityMappingRepo.findAll()) {
            capabilitiesByControl.computeIfAbsent(m.getControlId(), k -> new HashSet<>()).add(m.getCapabilityId());
        }

        Map<String, List<String>> uniqueByCapability = new TreeMap<>();
        capabilitiesByControl.forEach((controlId, owners) -> {
            if (owners.size() == 1) {
                String owner = owners.iterator().next();
                uniqueByCapability.computeIfAbsent(owner, k -> new ArrayList<>()).add(controlId);
            }
        });
        uniqueByCapability.values().forEach(Collections::sort);

        Map<String, Integer> counts = new LinkedHashMap<>();
        uniqueByCapability.forEach((cap, ids) -> counts.put(cap, ids.size()));

        List<String> capabilities = new ArrayList<>(uniqueByCapability.keySet());
        log.info("Found {} capabilities with unique controls", capabilities.size());
        return new UniqueControlsResponse(capabilities, capabilities.size(), counts, uniqueByCapability);
    }
}
