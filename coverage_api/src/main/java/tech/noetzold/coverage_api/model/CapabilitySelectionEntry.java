package tech.noetzold.coverage_api.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

public record CapabilitySelectionEntry(
        @NotBlank String capabilityId,
        @NotNull @JsonProperty("is_active") Boolean isActive
) {
    public static CapabilitySelectionEntry fromEntity(CapabilitySelection s) {
        return new CapabilitySelectionEntry(s.getCapabilityId(), s.isActive());
    }
}
