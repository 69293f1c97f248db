package tech.noetzold.coverage_api.model;

import java.util.List;

/**
 * Active selection to analyze. A null {@code controlIds} means no control-level
 * override; an empty list narrows the active controls to nothing.
 */
public record CoverageRequest(
        List<String> capabilityIds,
        List<String> controlIds
) {}
