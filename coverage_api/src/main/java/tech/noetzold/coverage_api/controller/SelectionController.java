package tech.noetzold.coverage_api.controller;

import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;
import tech.noetzold.coverage_api.model.*;
import tech.noetzold.coverage_api.service.ScenarioService;

import java.util.List;

@RestController
@Tag(name = "Scenarios")
@RequestMapping("/api")
@RequiredArgsConstructor
public class SelectionController {

    private final ScenarioService scenarioService;

    @PostMapping("/capability-selections")
    public SaveSelectionsResponse saveCapabilitySelections(@Valid @RequestBody CapabilitySelectionsRequest req) {
        return scenarioService.saveCapabilitySelections(req);
    }

    @GetMapping("/capability-selections/{scenarioId}")
    public List<CapabilitySelectionEntry> getCapabilitySelections(@PathVariable Long scenarioId,
                                                                  @RequestParam(value = "user_id", required = false) Long userId) {
        return scenarioService.getCapabilitySelections(scenarioId, userId);
    }

    @PostMapping("/control-selections")
    public SaveSelectionsResponse saveControlSelections(@Valid @RequestBody ControlSelectionsRequest req) {
        return scenarioService.saveControlSelections(req);
    }

    @GetMapping("/control-selections/{scenarioId}")
    public List<ControlSelectionEntry> getControlSelections(@PathVariable Long scenarioId,
                                                            @RequestParam(value = "user_id", required = false) Long userId) {
        return scenarioService.getControlSelections(scenarioId, userId);
    }
}
