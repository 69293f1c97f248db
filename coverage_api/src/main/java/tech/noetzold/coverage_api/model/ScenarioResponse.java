package tech.noetzold.coverage_api.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.*;

import java.time.Instant;

@Getter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ScenarioResponse {
    private Long scenarioId;
    private Long userId;
    private String scenarioName;
    @JsonProperty("is_default")
    private boolean defaultScenario;
    private Instant createdAt;
    private Instant updatedAt;

    public static ScenarioResponse fromEntity(CapabilityScenario e) {
        return ScenarioResponse.builder()
                .scenarioId(e.getScenarioId())
                .userId(e.getUserId())
                .scenarioName(e.getScenarioName())
                .defaultScenario(e.isDefault())
                .createdAt(e.getCreatedAt())
                .updatedAt(e.getUpdatedAt())
                .build();
    }
}
