package tech.noetzold.coverage_api.model;

import java.util.List;

public record ActiveControlDetail(
        String controlId,
        String controlDescription,
        List<String> capabilityNames
) {}
