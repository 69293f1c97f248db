package tech.noetzold.coverage_api.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record ScenarioCreateRequest(
        @NotNull Long userId,
        @NotBlank @Size(max = 255) String scenarioName,
        @JsonProperty("is_default") Boolean isDefault
) {
    public boolean defaultRequested() {
        return Boolean.TRUE.equals(isDefault);
    }
}
