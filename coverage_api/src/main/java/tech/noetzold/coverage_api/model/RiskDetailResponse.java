package tech.noetzold.coverage_api.model;

import java.util.List;

/**
 * A risk with the controls that mitigate it, ordered by control id.
 */
public record RiskDetailResponse(
        RiskSummary risk,
        List<ControlSummary> associatedControls
) {
    public record RiskSummary(String id, String title, String description) {
        public static RiskSummary fromEntity(Risk r) {
            return new RiskSummary(r.getRiskId(), r.getRiskTitle(), r.getRiskDescription());
        }
    }

    public record ControlSummary(String id, String title, String description, String domain,
                                 String type, String maturity) {
        public static ControlSummary fromEntity(Control c) {
            return new ControlSummary(c.getControlId(), c.getControlTitle(), c.getControlDescription(),
                    c.getSecurityFunction(), c.getControlType(), c.getMaturityLevel());
        }
    }
}
