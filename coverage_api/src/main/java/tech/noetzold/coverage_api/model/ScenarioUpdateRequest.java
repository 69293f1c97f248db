package tech.noetzold.coverage_api.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Size;

import java.util.List;

/**
 * Partial update. Null fields are left untouched; a non-null selection list
 * replaces every stored selection of that type.
 */
public record ScenarioUpdateRequest(
        @Size(max = 255) String scenarioName,
        @JsonProperty("is_default") Boolean isDefault,
        List<@Valid CapabilitySelectionEntry> selections,
        List<@Valid ControlSelectionEntry> controlSelections
) {}
