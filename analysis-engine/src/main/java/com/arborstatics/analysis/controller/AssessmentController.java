package com.arborstatics.analysis.controller;

import com.arborstatics.analysis.dto.AssessmentReport;
import com.arborstatics.analysis.dto.AssessmentRequest;
import com.arborstatics.analysis.dto.PruningReport;
import com.arborstatics.analysis.dto.PruningRequest;
import com.arborstatics.analysis.service.AssessmentService;
import com.arborstatics.common.catalogue.SpeciesCatalogue;
import com.arborstatics.common.catalogue.WindCatalogue;
import com.arborstatics.common.model.SpeciesProfile;
import com.arborstatics.common.model.ValidationIssue;
import com.arborstatics.common.model.WindProfile;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.util.List;

@RestController
@RequestMapping("/api/v1/assessment")
public class AssessmentController {

    private final AssessmentService assessmentService;
    private final SpeciesCatalogue speciesCatalogue;
    private final WindCatalogue windCatalogue;

    public AssessmentController(AssessmentService assessmentService,
                                SpeciesCatalogue speciesCatalogue,
                                WindCatalogue windCatalogue) {
        this.assessmentService = assessmentService;
        this.speciesCatalogue = speciesCatalogue;
        this.windCatalogue = windCatalogue;
    }

    @GetMapping("/species")
    public ResponseEntity<List<SpeciesProfile>> species() {
        return ResponseEntity.ok(List.copyOf(speciesCatalogue.all()));
    }

    @GetMapping("/wind-profiles")
    public ResponseEntity<List<WindProfile>> windProfiles() {
        return ResponseEntity.ok(List.copyOf(windCatalogue.all()));
    }

    @PostMapping("/validate")
    public Mono<ResponseEntity<List<ValidationIssue>>> validate(@RequestBody AssessmentRequest request) {
        return assessmentService.validate(request)
            .map(ResponseEntity::ok);
    }

    @PostMapping("/evaluate")
    public Mono<ResponseEntity<AssessmentReport>> evaluate(@RequestBody AssessmentRequest request) {
        return assessmentService.assess(request)
            .map(ResponseEntity::ok);
    }

    @PostMapping("/pruning")
    public Mono<ResponseEntity<PruningReport>> pruning(@RequestBody PruningRequest request) {
        return assessmentService.pruning(request)
            .map(ResponseEntity::ok);
    }

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("OK");
    }
}
