package com.arborstatics.analysis.service;

import com.arborstatics.analysis.dto.AssessmentReport;
import com.arborstatics.analysis.dto.AssessmentRequest;
import com.arborstatics.analysis.dto.PruningReport;
import com.arborstatics.analysis.dto.PruningRequest;
import com.arborstatics.common.catalogue.SpeciesCatalogue;
import com.arborstatics.common.catalogue.WindCatalogue;
import com.arborstatics.common.defect.DefectStrengthComposer;
import com.arborstatics.common.exception.InvalidAssessmentException;
import com.arborstatics.common.model.CalculationResult;
import com.arborstatics.common.model.Curve;
import com.arborstatics.common.model.DecayAnalysis;
import com.arborstatics.common.model.LoadScenario;
import com.arborstatics.common.model.PruningScenarioResult;
import com.arborstatics.common.model.RootPlateAssessment;
import com.arborstatics.common.model.SafetyMarginRating;
import com.arborstatics.common.model.SpeciesProfile;
import com.arborstatics.common.model.TreeGeometry;
import com.arborstatics.common.model.ValidationIssue;
import com.arborstatics.common.rootplate.RootPlateStabilityComposer;
import com.arborstatics.common.scenario.ScenarioGenerator;
import com.arborstatics.common.section.SectionLoadCalculator;
import com.arborstatics.common.threshold.SolverSettings;
import com.arborstatics.common.threshold.ThresholdSolver;
import com.arborstatics.common.validation.InputValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.concurrent.Callable;

/**
 * Gates raw requests through the validator, runs the statics engine and
 * assembles the report. Independent sweeps run concurrently on the
 * bounded-elastic scheduler; the engine itself is pure, so results do not
 * depend on scheduling.
 */
@Service
public class AssessmentService {

    private static final Logger log = LoggerFactory.getLogger(AssessmentService.class);

    private final SpeciesCatalogue speciesCatalogue;
    private final WindCatalogue windCatalogue;
    private final SolverSettings solverSettings;

    public AssessmentService(SpeciesCatalogue speciesCatalogue,
                             WindCatalogue windCatalogue,
                             SolverSettings solverSettings) {
        this.speciesCatalogue = speciesCatalogue;
        this.windCatalogue = windCatalogue;
        this.solverSettings = solverSettings;
    }

    public Mono<List<ValidationIssue>> validate(AssessmentRequest request) {
        return Mono.fromCallable(() -> collectIssues(request, resolveDesignWind(request)));
    }

    public Mono<AssessmentReport> assess(AssessmentRequest request) {
        return Mono.fromCallable(() -> prepare(request))
            .flatMap(this::buildReport)
            .doOnError(e -> log.warn("[AssessmentService] Assessment rejected. species={} reason={}",
                request.speciesId(), e.getMessage()));
    }

    public Mono<PruningReport> pruning(PruningRequest request) {
        return Mono.fromCallable(() -> prepare(requireAssessment(request)))
            .flatMap(p -> {
                Mono<PruningScenarioResult> scenario = offload("pruningScenario", () ->
                    ScenarioGenerator.pruningScenario(p.species(), p.geometry(), p.scenario(),
                        request.crownReductionPercent(), request.fullnessReductionPercent()));
                Mono<Curve> curve = offload("crownReductionCurve", () ->
                    ScenarioGenerator.safetyFactorVsCrownReduction(p.species(), p.geometry(), p.scenario(),
                        request.crownReductionPercent(), request.fullnessReductionPercent()));
                return Mono.zip(scenario, curve, PruningReport::new);
            })
            .doOnSuccess(r -> log.info("[AssessmentService] Pruning scenario. sfBefore={} sfAfter={}",
                r.scenario().before().safetyFactor(), r.scenario().after().safetyFactor()));
    }

    // ── Preparation ─────────────────────────────────────────────────────────

    private static AssessmentRequest requireAssessment(PruningRequest request) {
        if (request.assessment() == null) {
            throw new InvalidAssessmentException(List.of(
                ValidationIssue.error("Pruning request must include the tree assessment.")));
        }
        return request.assessment();
    }

    record PreparedAssessment(
        AssessmentRequest request,
        SpeciesProfile species,
        TreeGeometry geometry,
        LoadScenario scenario,
        List<ValidationIssue> issues
    ) {}

    PreparedAssessment prepare(AssessmentRequest request) {
        SpeciesProfile species = speciesCatalogue.get(request.speciesId());
        Double designWind = resolveDesignWind(request);

        List<ValidationIssue> issues = collectIssues(request, designWind);
        if (InputValidator.hasErrors(issues)) {
            throw new InvalidAssessmentException(issues);
        }

        TreeGeometry geometry = new TreeGeometry(
            request.dbh(), request.height(), request.crownDiameter(), request.cavityInnerDiameter());
        double defectFactor = DefectStrengthComposer.compose(request.defects(), request.height());
        LoadScenario scenario = new LoadScenario(
            designWind, request.siteFactorOrDefault(), request.fullnessOverride(), defectFactor);

        log.info("[AssessmentService] Assessing species={} dbh={} height={} wind={} kDefect={}",
            species.id(), request.dbh(), request.height(), designWind, defectFactor);
        return new PreparedAssessment(request, species, geometry, scenario, issues);
    }

    private List<ValidationIssue> collectIssues(AssessmentRequest request, Double designWind) {
        List<ValidationIssue> issues = new ArrayList<>(InputValidator.validate(
            request.dbh(), request.height(), request.crownDiameter(),
            designWind, request.cavityInnerDiameter()));
        if (request.siteFactor() != null && request.siteFactor() < 0.0) {
            issues.add(ValidationIssue.error("Site factor cannot be negative."));
        }
        return issues;
    }

    /** Explicit speed first, then the named wind profile, else {@code null}. */
    Double resolveDesignWind(AssessmentRequest request) {
        if (request.designWindSpeed() != null) {
            return request.designWindSpeed();
        }
        if (request.windProfileId() != null) {
            return windCatalogue.get(request.windProfileId()).designWindSpeed();
        }
        return null;
    }

    // ── Report ──────────────────────────────────────────────────────────────

    private Mono<AssessmentReport> buildReport(PreparedAssessment p) {
        SpeciesProfile species = p.species();
        TreeGeometry geometry = p.geometry();
        LoadScenario scenario = p.scenario();

        CalculationResult result = SectionLoadCalculator.evaluate(species, geometry, scenario);
        OptionalDouble windToFailure = ThresholdSolver.windToFailure(scenario.designWindSpeed(), result.safetyFactor());

        List<ValidationIssue> issues = new ArrayList<>(p.issues());
        issues.addAll(InputValidator.postCalculationWarnings(result));

        RootPlateAssessment rootPlate = p.request().rootPlate() == null
            ? null
            : RootPlateStabilityComposer.compose(p.request().rootPlate(), p.request().dbh());

        Mono<Curve> windCurve = offload("safetyFactorVsWind", () ->
            ScenarioGenerator.safetyFactorVsWind(species, geometry, scenario));
        Mono<DecayAnalysis> decay = offload("decayAnalysis", () ->
            ScenarioGenerator.decayAnalysis(species, geometry, scenario));
        Mono<Curve> tolerance = decayToleranceCurve(species, geometry, scenario);
        Mono<Map<String, Double>> windScenarios = offload("windScenarios", () ->
            ScenarioGenerator.windScenarioComparison(species, geometry, scenario, windCatalogue.all()));

        return Mono.zip(windCurve, decay, tolerance, windScenarios)
            .map(t -> new AssessmentReport(
                species.id(),
                scenario.designWindSpeed(),
                List.copyOf(issues),
                scenario.defectStrengthFactor(),
                SectionLoadCalculator.effectiveFullness(species, scenario.fullnessOverride()),
                result,
                SafetyMarginRating.of(result.safetyFactor()),
                windToFailure.isPresent() ? windToFailure.getAsDouble() : null,
                rootPlate,
                t.getT2(),
                t.getT1(),
                t.getT3(),
                t.getT4()))
            .doOnSuccess(r -> log.info("[AssessmentService] Assessment complete. species={} sf={} rating={} windToFailure={}",
                r.speciesId(), r.result().safetyFactor(), r.rating(), r.windToFailure()));
    }

    /**
     * Parallel form of {@link ThresholdSolver#decayToleranceCurve}: one
     * bisection per sampled wind speed, reassembled in wind order.
     */
    private Mono<Curve> decayToleranceCurve(SpeciesProfile species, TreeGeometry geometry, LoadScenario scenario) {
        double[] winds = ThresholdSolver.decayToleranceWindSpeeds(species, geometry, scenario);
        return Flux.range(0, winds.length)
            .map(i -> winds[i])
            .flatMapSequential(v -> Mono.fromCallable(() ->
                    ThresholdSolver.decayTolerancePoint(species, geometry, scenario, v, solverSettings))
                .subscribeOn(Schedulers.boundedElastic())
                .filter(Optional::isPresent)
                .map(Optional::get))
            .collectList()
            .map(Curve::new);
    }

    private <T> Mono<T> offload(String task, Callable<T> work) {
        return Mono.fromCallable(work)
            .subscribeOn(Schedulers.boundedElastic())
            .doOnSuccess(v -> log.debug("[AssessmentService] {} complete", task))
            .doOnError(e -> log.error("[AssessmentService] {} failed", task, e));
    }
}
