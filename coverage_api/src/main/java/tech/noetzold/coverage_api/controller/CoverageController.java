package tech.noetzold.coverage_api.controller;

import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.web.bind.annotation.*;
import tech.noetzold.coverage_api.model.CoverageReport;
import tech.noetzold.coverage_api.model.CoverageRequest;
import tech.noetzold.coverage_api.service.CoverageAnalyzer;

@RestController
@Tag(name = "Coverage")
@RequestMapping("/api")
public class CoverageController {

    private final CoverageAnalyzer analyzer;

    public CoverageController(CoverageAnalyzer analyzer) {
        this.analyzer = analyzer;
    }

    @PostMapping("/capability-analysis")
    public CoverageReport analyze(@RequestBody CoverageRequest req) {
        return analyzer.analyze(req);
    }
}
