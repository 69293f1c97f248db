package tech.noetzold.coverage_api.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import tech.noetzold.coverage_api.model.*;
import tech.noetzold.coverage_api.repository.MappingStore;

import java.util.*;

/**
 * Classifies every risk as fully covered, partially covered or exposed for a
 * given active capability selection.
 * <p>
 * A risk is fully covered only when every control mapped to it is active. A risk
 * with no mapped controls can never be covered and is always reported exposed.
 * The analysis performs no writes; all reads happen in one read-only transaction
 * so a single report sees one snapshot of the mapping tables.
 */
@Slf4j
@Service
public class CoverageAnalyzer {

    static final String NO_TITLE = "No title";
    static final String NO_DESCRIPTION = "No description";

    private final MappingStore store;

    public CoverageAnalyzer(MappingStore store) {
        this.store = store;
    }

    @Transactional(readOnly = true)
    public CoverageReport analyze(CoverageRequest req) {
        return analyze(req.capabilityIds(), req.controlIds());
    }

    /**
     * @param activeCapabilityIds capabilities marked active; null is treated as empty
     * @param activeControlIds    control-level override; null means no override, an
     *                            empty collection deactivates every control
     */
    @Transactional(readOnly = true)
    public CoverageReport analyze(Collection<String> activeCapabilityIds, Collection<String> activeControlIds) {
        Set<String> capabilityIds = toSet(activeCapabilityIds);

        long totalControls = store.totalControls();
        Set<String> controlsInCapabilities = store.allControlsInAnyCapability();

        Set<String> activeControls = new HashSet<>(store.controlsForCapabilities(capabilityIds));
        if (activeControlIds != null) {
            activeControls.retainAll(toSet(activeControlIds));
        }

        Set<String> riskIds = store.allRiskIds();
        Map<String, Set<String>> requiredByRisk = store.requiredControlsByRisk();
        Map<String, Risk> risks = store.risksById(riskIds);

        List<PartiallyCoveredRisk> partial = new ArrayList<>();
        List<ExposedRisk> exposed = new ArrayList<>();
        long fullyCovered = 0;

        for (String riskId : riskIds) {
            Set<String> required = requiredByRisk.getOrDefault(riskId, Set.of());
            Risk risk = risks.get(riskId);

            if (required.isEmpty()) {
                exposed.add(new ExposedRisk(riskId, titleOf(risk), descriptionOf(risk), List.of(), 0));
                continue;
            }

            Set<String> activeRequired = new HashSet<>(required);
            activeRequired.retainAll(activeControls);

            if (activeRequired.size() == required.size()) {
                fullyCovered++;
            } else if (!activeRequired.isEmpty()) {
                Set<String> inactive = new HashSet<>(required);
                inactive.removeAll(activeRequired);
                partial.add(new PartiallyCoveredRisk(
                        riskId, titleOf(risk), descriptionOf(risk),
                        new ArrayList<>(activeRequired),
                        new ArrayList<>(inactive),
                        required.size()));
            } else {
                exposed.add(new ExposedRisk(
                        riskId, titleOf(risk), descriptionOf(risk),
                        new ArrayList<>(required),
                        required.size()));
            }
        }

        List<ActiveControlDetail> activeControlsList = describeActiveControls(activeControls);

        log.debug("Coverage computed: capabilities={} activeControls={} risks={} full={} partial={} exposed={}",
                capabilityIds.size(), activeControls.size(), riskIds.size(), fullyCovered, partial.size(), exposed.size());

        return new CoverageReport(
                totalControls,
                controlsInCapabilities.size(),
                activeControls.size(),
                exposed.size(),
                riskIds.size(),
                fullyCovered,
                partial.size(),
                activeControlsList,
                partial,
                exposed
        );
    }

    private List<ActiveControlDetail> describeActiveControls(Set<String> activeControls) {
        if (activeControls.isEmpty()) return new ArrayList<>();

        Map<String, Control> controls = store.controlsById(activeControls);
        Map<String, List<String>> capabilityNames = store.capabilityNamesForControls(activeControls);

        List<ActiveControlDetail> details = new ArrayList<>(activeControls.size());
        for (String controlId : activeControls) {
            Control control = controls.get(controlId);
            String description = control != null && control.getControlDescription() != null
                    ? control.getControlDescription()
                    : "";
            details.add(new ActiveControlDetail(
                    controlId,
                    description,
                    capabilityNames.getOrDefault(controlId, List.of())));
        }
        return details;
    }

    private static String titleOf(Risk risk) {
        return risk != null && risk.getRiskTitle() != null && !risk.getRiskTitle().isBlank()
                ? risk.getRiskTitle()
                : NO_TITLE;
    }

    private static String descriptionOf(Risk risk) {
        return risk != null && risk.getRiskDescription() != null && !risk.getRiskDescription().isBlank()
                ? risk.getRiskDescription()
                : NO_DESCRIPTION;
    }

    private static Set<String> toSet(Collection<String> ids) {
        Set<String> out = new HashSet<>();
        if (ids == null) return out;
        for (String id : ids) {
            if (id != null) out.add(id);
        }
        return out;
    }
}
