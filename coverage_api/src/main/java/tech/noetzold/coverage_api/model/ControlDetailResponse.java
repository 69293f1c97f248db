package tech.noetzold.coverage_api.model;

import java.util.List;

public record ControlDetailResponse(
        ControlInfo control,
        List<RiskDetailResponse.RiskSummary> associatedRisks
) {
    public record ControlInfo(String id, String title, String description, String domain,
                              String type, String maturity, String assetType) {
        public static ControlInfo fromEntity(Control c) {
            return new ControlInfo(c.getControlId(), c.getControlTitle(), c.getControlDescription(),
                    c.getSecurityFunction(), c.getControlType(), c.getMaturityLevel(), c.getAssetType());
        }
    }
}
