package tech.noetzold.coverage_api.model;

import java.util.List;

public record PartiallyCoveredRisk(
        String riskId,
        String riskTitle,
        String riskDescription,
        List<String> activeControls,
        List<String> inactiveControls,
        int totalControls
) {}
