package my.sitescreener.app.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import my.sitescreener.app.domain.RunStatus;
import my.sitescreener.app.dto.CandidateTierRequest;
import my.sitescreener.app.dto.CandidateTierResultDto;
import my.sitescreener.app.dto.KillSummaryItemDto;
import my.sitescreener.app.dto.RollupResultDto;
import my.sitescreener.app.dto.RunDto;
import my.sitescreener.app.dto.RunFailRequest;
import my.sitescreener.app.dto.RunPageDto;
import my.sitescreener.app.dto.RunStartRequest;
import my.sitescreener.app.dto.StageExecutionResult;
import my.sitescreener.app.dto.StageHistogramDto;
import my.sitescreener.app.dto.StageLogEntryDto;
import my.sitescreener.app.service.AggregationRollupService;
import my.sitescreener.app.service.CandidateTierService;
import my.sitescreener.app.service.RunRegistryService;
import my.sitescreener.app.service.StageExecutorService;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Locale;
import java.util.UUID;

@RestController
@RequestMapping("/api/runs")
@Tag(name = "Screening Runs")
public class RunController {
	private final RunRegistryService runRegistry;
	private final StageExecutorService stageExecutor;
	private final AggregationRollupService rollupService;
	private final CandidateTierService candidateTierService;

	public RunController(RunRegistryService runRegistry,
						 StageExecutorService stageExecutor,
						 AggregationRollupService rollupService,
						 CandidateTierService candidateTierService) {
		this.runRegistry = runRegistry;
		this.stageExecutor = stageExecutor;
		this.rollupService = rollupService;
		this.candidateTierService = candidateTierService;
	}

	@PostMapping
	@ResponseStatus(HttpStatus.CREATED)
	@Operation(summary = "Start a run over the catalog ZIPs of the target states")
	public RunDto startRun(@Valid @RequestBody RunStartRequest request) {
		return runRegistry.startRun(request.targetStates(), request.config(), request.createdBy());
	}

	@GetMapping
	@Operation(summary = "List runs, newest first")
	public RunPageDto listRuns(@RequestParam(required = false) String status,
							   @RequestParam(defaultValue = "0") int page,
							   @RequestParam(defaultValue = "50") int size) {
		RunStatus statusFilter = null;
		if (status != null && !status.isBlank()) {
			statusFilter = RunStatus.valueOf(status.trim().toUpperCase(Locale.ROOT));
		}
		PageRequest pageable = PageRequest.of(Math.max(0, page), Math.max(1, size));
		Page<RunDto> runs = runRegistry.listRuns(statusFilter, pageable);
		return new RunPageDto(runs.getContent(), Math.toIntExact(runs.getTotalElements()), pageable.getPageSize(),
				Math.toIntExact(pageable.getOffset()));
	}

	@GetMapping("/{runId}")
	public RunDto getRun(@PathVariable UUID runId) {
		return runRegistry.getRun(runId);
	}

	@PostMapping("/{runId}/stages/{stage}")
	@Operation(summary = "Execute one screening stage")
	public StageExecutionResult executeStage(@PathVariable UUID runId, @PathVariable int stage) {
		return stageExecutor.executeStage(runId, stage);
	}

	@PostMapping("/{runId}/complete")
	public RunDto completeRun(@PathVariable UUID runId) {
		return runRegistry.completeRun(runId);
	}

	@PostMapping("/{runId}/fail")
	public RunDto failRun(@PathVariable UUID runId, @Valid @RequestBody RunFailRequest request) {
		return runRegistry.failRun(runId, request.error());
	}

	@GetMapping("/{runId}/stage-log")
	public List<StageLogEntryDto> stageLog(@PathVariable UUID runId) {
		return runRegistry.stageLog(runId);
	}

	@GetMapping("/{runId}/histogram")
	@Operation(summary = "Candidate count per stage reached")
	public StageHistogramDto histogram(@PathVariable UUID runId) {
		return runRegistry.stageHistogram(runId);
	}

	@GetMapping("/{runId}/kill-summary")
	@Operation(summary = "Kills per stage and rule")
	public List<KillSummaryItemDto> killSummary(@PathVariable UUID runId) {
		return runRegistry.killSummary(runId);
	}

	@PostMapping("/{runId}/rollup")
	@Operation(summary = "Rebuild county aggregates from the run's survivors")
	public RollupResultDto rollup(@PathVariable UUID runId) {
		return rollupService.rollupAggregates(runId);
	}

	@PostMapping("/{runId}/candidate-tiers")
	@Operation(summary = "Assign tier 1 and tier 2 to the best surviving candidates")
	public CandidateTierResultDto assignCandidateTiers(@PathVariable UUID runId,
													   @Valid @RequestBody CandidateTierRequest request) {
		return candidateTierService.assignCandidateTiers(runId, request.profileId(), request.tier1Count(), request.tier2Count());
	}
}
