package tech.noetzold.coverage_api.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

public record ControlSelectionEntry(
        @NotBlank String controlId,
        @NotNull @JsonProperty("is_active") Boolean isActive
) {
    public static ControlSelectionEntry fromEntity(ControlSelection s) {
        return new ControlSelectionEntry(s.getControlId(), s.isActive());
    }
}
