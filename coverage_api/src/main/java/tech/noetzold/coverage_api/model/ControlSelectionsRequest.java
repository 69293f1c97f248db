package tech.noetzold.coverage_api.model;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;

import java.util.List;

public record ControlSelectionsRequest(
        @NotNull Long scenarioId,
        Long userId,
        @NotNull List<@Valid ControlSelectionEntry> selections
) {}
