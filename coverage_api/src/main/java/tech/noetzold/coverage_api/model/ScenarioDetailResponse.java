package tech.noetzold.coverage_api.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.*;

import java.time.Instant;
import java.util.List;

@Getter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ScenarioDetailResponse {
    private Long scenarioId;
    private Long userId;
    private String scenarioName;
    @JsonProperty("is_default")
    private boolean defaultScenario;
    private Instant createdAt;
    private Instant updatedAt;
    private List<CapabilitySelectionEntry> selections;
    private List<ControlSelectionEntry> controlSelections;

    public static ScenarioDetailResponse of(CapabilityScenario e,
                                            List<CapabilitySelectionEntry> selections,
                                            List<ControlSelectionEntry> controlSelections) {
        return ScenarioDetailResponse.builder()
                .scenarioId(e.getScenarioId())
                .userId(e.getUserId())
                .scenarioName(e.getScenarioName())
                .defaultScenario(e.isDefault())
                .createdAt(e.getCreatedAt())
                .updatedAt(e.getUpdatedAt())
                .selections(selections)
                .controlSelections(controlSelections)
                .build();
    }
}
