package com.architecture.memory.codegraph.service.workflow;

import com.architecture.memory.codegraph.dto.diff.GraphDiff;
import com.architecture.memory.codegraph.dto.extraction.BuildResult;
import com.architecture.memory.codegraph.dto.extraction.ExtractionPayload;
import com.architecture.memory.codegraph.dto.validation.ValidationReport;
import com.architecture.memory.codegraph.dto.workflow.EditingBaseline;
import com.architecture.memory.codegraph.dto.workflow.FixLoopResult;
import com.architecture.memory.codegraph.dto.workflow.ModuleOutcome;
import com.architecture.memory.codegraph.dto.workflow.WorkflowResult;
import com.architecture.memory.codegraph.exception.MalformedExtractionException;
import com.architecture.memory.codegraph.model.snapshot.GraphSnapshot;
import com.architecture.memory.codegraph.service.builder.GraphBuilder;
import com.architecture.memory.codegraph.service.propagation.ChangePropagator;
import com.architecture.memory.codegraph.service.snapshot.SnapshotService;
import com.architecture.memory.codegraph.service.validation.ConservationValidator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

/**
 * Re-indexes edited modules and checks the result:
 * snapshot, apply, mark, propagate, validate incrementally, snapshot again, diff.
 *
 * A rejected module does not stop the others. Changed flags are only cleared when the run passes,
 * so the next incremental validation still covers whatever needs fixing.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ValidationWorkflowService {

    static final int DEFAULT_MAX_ITERATIONS = 5;

    private final GraphBuilder graphBuilder;
    private final ChangePropagator changePropagator;
    private final ConservationValidator conservationValidator;
    private final SnapshotService snapshotService;

    /**
     * Records a baseline snapshot before edits to the given modules begin.
     */
    public EditingBaseline prepareForEditing(List<String> moduleIds, String description) {
        String label = description != null && !description.isBlank()
                ? description
                : "before editing " + moduleIds.size() + " module(s)";
        GraphSnapshot baseline = snapshotService.createSnapshot(label);
        log.info("[workflow] baseline snapshot={} modules={} nodes={} edges={}",
                baseline.getId(), moduleIds, baseline.nodeCount(), baseline.edgeCount());
        return EditingBaseline.builder()
                .snapshotId(baseline.getId())
                .label(label)
                .graphVersion(baseline.getGraphVersion())
                .nodeCount(baseline.nodeCount())
                .edgeCount(baseline.edgeCount())
                .plannedModules(new ArrayList<>(moduleIds))
                .build();
    }

    public WorkflowResult validateAfterEdit(List<ExtractionPayload> payloads, String label) {
        long start = System.currentTimeMillis();
        log.info("[workflow] started label={} modules={}", label, payloads.size());

        GraphSnapshot before = snapshotService.createSnapshot(label + ":before");

        List<ModuleOutcome> outcomes = new ArrayList<>();
        List<String> touchedModules = new ArrayList<>();
        for (ExtractionPayload payload : payloads) {
            ModuleOutcome outcome = applyModule(payload);
            outcomes.add(outcome);
            if (outcome.isApplied() && !outcome.getBuildResult().isUnchanged()) {
                touchedModules.add(outcome.getBuildResult().getModuleId());
            }
        }

        changePropagator.markChanged(touchedModules);
        Set<String> changed = changePropagator.propagate();
        ValidationReport report = conservationValidator.validateIncremental();

        GraphSnapshot after = snapshotService.createSnapshot(label + ":after");
        GraphDiff diff = snapshotService.diff(before, after);

        boolean modulesOk = outcomes.stream().allMatch(ModuleOutcome::isApplied);
        WorkflowResult.Status status = report.isValid() && modulesOk
                ? WorkflowResult.Status.PASSED
                : WorkflowResult.Status.NEEDS_FIXES;
        if (status == WorkflowResult.Status.PASSED) {
            changePropagator.clearChanged();
        }

        WorkflowResult result = WorkflowResult.builder()
                .status(status)
                .label(label)
                .beforeSnapshotId(before.getId())
                .afterSnapshotId(after.getId())
                .moduleOutcomes(outcomes)
                .changedNodeIds(new ArrayList<>(changed))
                .diffSummary(diff.getSummary())
                .report(report)
                .durationMs(System.currentTimeMillis() - start)
                .build();
        log.info("[workflow] finished label={} status={} failedModules={} changed={} errors={} warnings={}",
                label, status, result.getFailedModuleCount(), changed.size(),
                report.getErrorCount(), report.getWarningCount());
        return result;
    }

    public FixLoopResult iterativeFixLoop(List<ExtractionPayload> payloads,
                                          Function<WorkflowResult, List<ExtractionPayload>> fixes, String label) {
        return iterativeFixLoop(payloads, fixes, label, DEFAULT_MAX_ITERATIONS);
    }

    /**
     * Validates {@code payloads}, then keeps applying the batches {@code fixes} derives from the last
     * result until a run passes, no fix is offered, or {@code maxIterations} runs have been made.
     */
    public FixLoopResult iterativeFixLoop(List<ExtractionPayload> payloads,
                                          Function<WorkflowResult, List<ExtractionPayload>> fixes,
                                          String label, int maxIterations) {
        if (maxIterations < 1) {
            throw new IllegalArgumentException("maxIterations must be at least 1, got " + maxIterations);
        }
        List<WorkflowResult> iterations = new ArrayList<>();
        List<ExtractionPayload> batch = payloads;

        for (int i = 1; i <= maxIterations; i++) {
            WorkflowResult result = validateAfterEdit(batch, label + ":" + i);
            iterations.add(result);
            if (result.isValid()) {
                log.info("[workflow] fix loop converged label={} iterations={}", label, i);
                break;
            }
            if (i == maxIterations) {
                log.warn("[workflow] fix loop gave up label={} iterations={} errors={}",
                        label, i, result.getReport() != null ? result.getReport().getErrorCount() : 0);
                break;
            }
            batch = fixes.apply(result);
            if (batch == null || batch.isEmpty()) {
                log.info("[workflow] fix loop stopped label={} iterations={}: no fixes offered", label, i);
                break;
            }
        }

        return FixLoopResult.builder()
                .label(label)
                .maxIterations(maxIterations)
                .converged(iterations.get(iterations.size() - 1).isValid())
                .iterations(iterations)
                .build();
    }

    /**
     * Runs {@link #validateAfterEdit} on the async executor. Failures are reported in the result
     * rather than through the future.
     */
    @Async
    public CompletableFuture<WorkflowResult> validateAfterEditAsync(List<ExtractionPayload> payloads, String label) {
        try {
            return CompletableFuture.completedFuture(validateAfterEdit(payloads, label));
        } catch (Exception e) {
            log.error("[workflow] failed label={}: {}", label, e.getMessage(), e);
            return CompletableFuture.completedFuture(WorkflowResult.builder()
                    .status(WorkflowResult.Status.FAILED)
                    .label(label)
                    .errorMessage(e.getMessage())
                    .build());
        }
    }

    private ModuleOutcome applyModule(ExtractionPayload payload) {
        try {
            BuildResult result = graphBuilder.applyExtraction(payload);
            return ModuleOutcome.builder()
                    .moduleId(payload.getModuleId())
                    .applied(true)
                    .buildResult(result)
                    .build();
        } catch (MalformedExtractionException e) {
            log.warn("[workflow] module rejected module={} problems={}", payload.getModuleId(), e.getProblems().size());
            return ModuleOutcome.builder()
                    .moduleId(payload.getModuleId())
                    .applied(false)
                    .error(e.getMessage())
                    .problems(new ArrayList<>(e.getProblems()))
                    .build();
        }
    }
}
