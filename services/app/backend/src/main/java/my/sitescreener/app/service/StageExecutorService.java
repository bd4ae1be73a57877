package my.sitescreener.app.service;

import my.sitescreener.app.domain.CandidateRecord;
import my.sitescreener.app.domain.RunStatus;
import my.sitescreener.app.domain.StageStatus;
import my.sitescreener.app.dto.RunDto;
import my.sitescreener.app.dto.StageExecutionResult;
import my.sitescreener.app.provider.FactProvider;
import my.sitescreener.app.provider.FactRecord;
import my.sitescreener.app.repository.CandidateRecordRepository;
import my.sitescreener.app.repository.StageLogRepository;
import my.sitescreener.app.screening.CandidateContext;
import my.sitescreener.app.screening.KillDecision;
import my.sitescreener.app.screening.ScreeningStageCatalog;
import my.sitescreener.app.screening.StageDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Applies one stage's kill switches to the live candidates of a run.
 * <p>
 * Each kill or merge commits on its own, so an interrupted stage keeps its progress and can be
 * executed again: candidates that already reached the stage are skipped, candidates the provider
 * could not answer for stay where they were and are reported as unresolved.
 */
@Service
public class StageExecutorService {
	private static final Logger logger = LoggerFactory.getLogger(StageExecutorService.class);

	private final RunRegistryService runRegistry;
	private final CandidateStateService candidateState;
	private final CandidateRecordRepository candidateRepository;
	private final StageLogRepository stageLogRepository;
	private final ScreeningStageCatalog stageCatalog;
	private final FactProvider factProvider;

	public StageExecutorService(RunRegistryService runRegistry,
								CandidateStateService candidateState,
								CandidateRecordRepository candidateRepository,
								StageLogRepository stageLogRepository,
								ScreeningStageCatalog stageCatalog,
								FactProvider factProvider) {
		this.runRegistry = runRegistry;
		this.candidateState = candidateState;
		this.candidateRepository = candidateRepository;
		this.stageLogRepository = stageLogRepository;
		this.stageCatalog = stageCatalog;
		this.factProvider = factProvider;
	}

	/**
	 * @throws PrecedenceViolationException when the run is not running or the previous stage has
	 *                                      never been logged
	 */
	public StageExecutionResult executeStage(UUID runId, int stage) {
		RunDto run = runRegistry.getRun(runId);
		if (run.status() != RunStatus.RUNNING) {
			throw new PrecedenceViolationException(runId, stage,
					"Run " + runId + " is " + run.status() + "; stages only execute on running runs");
		}
		if (stage > 0 && !stageLogRepository.existsByRunIdAndStage(runId, stage - 1)) {
			throw new PrecedenceViolationException(runId, stage,
					"Stage " + stage + " requires stage " + (stage - 1) + " to be executed first");
		}
		StageDefinition definition = stageCatalog.stage(stage, run.config());

		LocalDateTime startedAt = LocalDateTime.now();
		List<CandidateRecord> live = candidateRepository.findByRunIdAndKilledFalseOrderByZipAsc(runId);
		int killed = 0;
		int advanced = 0;
		int unresolved = 0;
		int alreadyAdvanced = 0;
		Map<String, Integer> killsByRule = new LinkedHashMap<>();
		definition.ruleIds().forEach(ruleId -> killsByRule.put(ruleId, 0));

		for (CandidateRecord candidate : live) {
			if (candidate.getStageReached() >= stage) {
				alreadyAdvanced++;
				continue;
			}
			if (candidate.getStageReached() < stage - 1) {
				unresolved++;
				continue;
			}
			FactRecord facts;
			try {
				facts = factProvider.lookupCandidate(candidate.getZip(), definition.factSet());
			} catch (ProviderUnavailableException ex) {
				logger.warn("Run {} stage {}: facts unavailable for {}: {}", runId, stage, candidate.getZip(), ex.getMessage());
				unresolved++;
				continue;
			}
			CandidateContext context = new CandidateContext(candidate.getZip(), facts, candidate.getMetrics());
			KillDecision decision = definition.evaluate(context);
			if (decision.killed()) {
				if (candidateState.killCandidate(runId, candidate.getZip(), stage, decision.ruleId(), decision.reason(),
						decision.threshold(), decision.observedValue())) {
					killed++;
					killsByRule.merge(decision.ruleId(), 1, Integer::sum);
				}
			} else if (candidateState.mergeMetrics(runId, candidate.getZip(), stage, definition.survivorMetrics().apply(context))) {
				advanced++;
			}
		}

		int input = live.size();
		int output = input - killed;
		StageStatus status = unresolved > 0 ? StageStatus.PARTIAL : StageStatus.COMPLETE;
		runRegistry.logStage(runId, stage, input, output, startedAt, status);

		if (unresolved > 0) {
			logger.warn("Run {} stage {} ({}) left {} candidates unresolved", runId, stage, definition.name(), unresolved);
		}
		logger.info("Run {} stage {} ({}): input={}, output={}, killed={}, kills={}",
				runId, stage, definition.name(), input, output, killed, killsByRule);
		return new StageExecutionResult(runId, stage, input, output, killed, advanced, unresolved, alreadyAdvanced,
				killsByRule, status);
	}
}
