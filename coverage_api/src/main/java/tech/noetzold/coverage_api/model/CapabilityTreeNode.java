package tech.noetzold.coverage_api.model;

import java.util.List;

public record CapabilityTreeNode(
        String capabilityId,
        String capabilityName,
        String capabilityType,
        String capabilityDomain,
        String capabilityDefinition,
        List<TreeControl> controls,
        List<TreeRisk> risks
) {
    public record TreeControl(String controlId, String controlTitle, String controlDomain) {}

    public record TreeRisk(String riskId, String riskTitle) {}
}
