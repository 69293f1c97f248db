package tech.noetzold.coverage_api.controller;

import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.web.bind.annotation.*;
import tech.noetzold.coverage_api.model.*;
import tech.noetzold.coverage_api.service.CapabilityCatalogService;

import java.util.List;
import java.util.Map;

@RestController
@Tag(name = "Catalog")
@RequestMapping("/api")
public class CapabilityController {

    private final CapabilityCatalogService catalog;

    public CapabilityController(CapabilityCatalogService catalog) {
        this.catalog = catalog;
    }

    @GetMapping("/capabilities")
    public List<Capability> list(@RequestParam(value = "capability_type", required = false) String capabilityType,
                                 @RequestParam(value = "domain", required = false) String domain,
                                 @RequestParam(value = "limit", required = false) Integer limit,
                                 @RequestParam(value = "offset", defaultValue = "0") int offset) {
        return catalog.list(capabilityType, domain, limit, offset);
    }

    @GetMapping("/capabilities/{capabilityId}")
    public Capability get(@PathVariable String capabilityId) {
        return catalog.get(capabilityId);
    }

    @GetMapping("/capability-tree")
    public List<CapabilityTreeNode> tree() {
        return catalog.tree();
    }

    @GetMapping("/controls/mapped")
    public Map<String, List<String>> mappedControls() {
        return Map.of("mapped_control_ids", catalog.mappedControlIds());
    }

    @GetMapping("/capability-unique-controls")
    public UniqueControlsResponse uniqueControls() {
        return catalog.uniqueControls();
    }

    @GetMapping("/risk/{riskId}")
    public RiskDetailResponse risk(@PathVariable String riskId) {
        return catalog.riskDetail(riskId);
    }

    @GetMapping("/control/{controlId}")
    public ControlDetailResponse control(@PathVariable String controlId) {
        return catalog.controlDetail(controlId);
    }
}
