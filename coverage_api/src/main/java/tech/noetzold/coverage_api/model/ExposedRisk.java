package tech.noetzold.coverage_api.model;

import java.util.List;

public record ExposedRisk(
        String riskId,
        String riskTitle,
        String riskDescription,
        List<String> requiredControls,   // empty when the risk has no mapped controls
        int totalControls
) {}
