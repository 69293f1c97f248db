package tech.noetzold.coverage_api.model;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;

import java.util.List;

public record CapabilitySelectionsRequest(
        @NotNull Long scenarioId,
        Long userId,
        @NotNull List<@Valid CapabilitySelectionEntry> selections
) {}
