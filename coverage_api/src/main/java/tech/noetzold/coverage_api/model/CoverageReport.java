package tech.noetzold.coverage_api.model;

import java.util.List;

public record CoverageReport(
        long totalControls,
        long controlsInCapabilities,
        long activeControls,
        long exposedRisks,
        long totalRisks,
        long activeRisks,              // fully covered
        long partiallyCoveredRisks,
        List<ActiveControlDetail> activeControlsList,
        List<PartiallyCoveredRisk> partiallyCoveredRisksList,
        List<ExposedRisk> exposedRisksList
) {}
