package tech.noetzold.coverage_api.controller;

import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;
import tech.noetzold.coverage_api.model.*;
import tech.noetzold.coverage_api.service.ScenarioService;

import java.util.List;
import java.util.Map;

@RestController
@Tag(name = "Scenarios")
@RequestMapping("/api/capability-scenarios")
@RequiredArgsConstructor
public class ScenarioController {

    private final ScenarioService scenarioService;

    @GetMapping
    public List<ScenarioResponse> list(@RequestParam("user_id") Long userId) {
        return scenarioService.listForUser(userId);
    }

    @PostMapping
    public ScenarioResponse create(@Valid @RequestBody ScenarioCreateRequest req) {
        return scenarioService.create(req);
    }

    @GetMapping("/{scenarioId}")
    public ScenarioDetailResponse get(@PathVariable Long scenarioId,
                                      @RequestParam(value = "user_id", required = false) Long userId) {
        return scenarioService.get(scenarioId, userId);
    }

    @PutMapping("/{scenarioId}")
    public ScenarioResponse update(@PathVariable Long scenarioId,
                                   @Valid @RequestBody ScenarioUpdateRequest req,
                                   @RequestParam(value = "user_id", required = false) Long userId) {
        return scenarioService.update(scenarioId, req, userId);
    }

    @DeleteMapping("/{scenarioId}")
    public Map<String, String> delete(@PathVariable Long scenarioId,
                                      @RequestParam(value = "user_id", required = false) Long userId) {
        scenarioService.delete(scenarioId, userId);
        return Map.of("message", "Scenario deleted successfully");
    }

    @GetMapping("/{scenarioId}/analysis")
    public CoverageReport analyze(@PathVariable Long scenarioId,
                                  @RequestParam(value = "user_id", required = false) Long userId) {
        return scenarioService.analyze(scenarioId, userId);
    }
}
