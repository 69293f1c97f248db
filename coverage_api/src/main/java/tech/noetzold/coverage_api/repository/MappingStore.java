package tech.noetzold.coverage_api.repository;

import tech.noetzold.coverage_api.model.Control;
import tech.noetzold.coverage_api.model.Risk;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Read-only view over the risk, control and capability tables populated by the
 * ETL pipeline. Unknown ids resolve to empty results, never to an exception.
 */
public interface MappingStore {

    long totalControls();

    long totalRisks();

    Set<String> allRiskIds();

    /** Distinct controls mapped to any of the given capabilities. */
    Set<String> controlsForCapabilities(Collection<String> capabilityIds);

    /** Distinct controls mapped to at least one capability. */
    Set<String> allControlsInAnyCapability();

    Set<String> requiredControlsForRisk(String riskId);

    /** Required controls keyed by risk id; risks without mappings are absent. */
    Map<String, Set<String>> requiredControlsByRisk();

    Map<String, Risk> risksById(Collection<String> riskIds);

    Map<String, Control> controlsById(Collection<String> controlIds);

    /** Names of the capabilities each control belongs to; unmapped controls are absent. */
    Map<String, List<String>> capabilityNamesForControls(Collection<String> controlIds);
}
