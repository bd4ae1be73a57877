package my.sitescreener.app.service;

import my.sitescreener.app.domain.CandidateRecord;
import my.sitescreener.app.domain.RunStatus;
import my.sitescreener.app.domain.ScreeningRun;
import my.sitescreener.app.domain.StageLogEntry;
import my.sitescreener.app.domain.StageStatus;
import my.sitescreener.app.dto.KillSummaryItemDto;
import my.sitescreener.app.dto.RunDto;
import my.sitescreener.app.dto.StageHistogramDto;
import my.sitescreener.app.dto.StageLogEntryDto;
import my.sitescreener.app.provider.FactProvider;
import my.sitescreener.app.repository.CandidateRecordRepository;
import my.sitescreener.app.repository.ScreeningRunRepository;
import my.sitescreener.app.repository.StageLogRepository;
import my.sitescreener.app.screening.ScreeningStageCatalog;
import my.sitescreener.app.screening.ScreeningThresholds;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Lifecycle of screening runs: creation with the candidate universe snapshot, stage bookkeeping,
 * completion and failure.
 */
@Service
public class RunRegistryService {
	private static final Logger logger = LoggerFactory.getLogger(RunRegistryService.class);
	private static final Pattern STATE_CODE = Pattern.compile("^[A-Z]{2}$");
	private static final int ERROR_MAX_LENGTH = 2000;
	private static final int INSERT_BATCH_SIZE = 500;

	private final ScreeningRunRepository runRepository;
	private final CandidateRecordRepository candidateRepository;
	private final StageLogRepository stageLogRepository;
	private final FactProvider factProvider;
	private final ScreeningStageCatalog stageCatalog;

	public RunRegistryService(ScreeningRunRepository runRepository,
							  CandidateRecordRepository candidateRepository,
							  StageLogRepository stageLogRepository,
							  FactProvider factProvider,
							  ScreeningStageCatalog stageCatalog) {
		this.runRepository = runRepository;
		this.candidateRepository = candidateRepository;
		this.stageLogRepository = stageLogRepository;
		this.factProvider = factProvider;
		this.stageCatalog = stageCatalog;
	}

	/**
	 * Creates a running run with one candidate record per catalog ZIP in the target states. The
	 * resolved stage thresholds are stored in the run config so later default changes do not
	 * affect the run.
	 *
	 * @throws ConfigurationException when the states are invalid, the config cannot be resolved
	 *                                or no candidate matches
	 */
	@Transactional
	public RunDto startRun(List<String> targetStates, Map<String, Object> config, String createdBy) {
		List<String> states = normalizeStates(targetStates);
		ScreeningThresholds thresholds = stageCatalog.thresholds(config);
		List<String> zips = factProvider.findCandidateKeys(states);
		if (zips.isEmpty()) {
			throw new ConfigurationException("No candidate ZIPs found for states " + states);
		}

		Map<String, Object> snapshot = new LinkedHashMap<>();
		if (config != null) {
			snapshot.putAll(config);
		}
		snapshot.putAll(thresholds.asConfig());

		LocalDateTime now = LocalDateTime.now();
		ScreeningRun run = new ScreeningRun();
		run.setRunId(UUID.randomUUID());
		run.setCreatedAt(now);
		run.setCreatedBy(createdBy == null || createdBy.isBlank() ? "system" : createdBy.trim());
		run.setTargetStates(states);
		run.setConfig(snapshot);
		run.setStatus(RunStatus.RUNNING);
		run.setTotalZips(zips.size());
		run.setSurvivingZips(zips.size());
		runRepository.save(run);

		List<CandidateRecord> batch = new ArrayList<>(INSERT_BATCH_SIZE);
		for (String zip : zips) {
			CandidateRecord record = new CandidateRecord();
			record.setRunId(run.getRunId());
			record.setZip(zip);
			record.setCreatedAt(now);
			record.setUpdatedAt(now);
			batch.add(record);
			if (batch.size() == INSERT_BATCH_SIZE) {
				candidateRepository.saveAll(batch);
				batch = new ArrayList<>(INSERT_BATCH_SIZE);
			}
		}
		if (!batch.isEmpty()) {
			candidateRepository.saveAll(batch);
		}
		logger.info("Started run {} for states {} with {} candidate ZIPs", run.getRunId(), states, zips.size());
		return toDto(run);
	}

	/**
	 * Marks the run complete and records the number of live candidates. Calling it again only
	 * refreshes the same values.
	 */
	@Transactional
	public RunDto completeRun(UUID runId) {
		ScreeningRun run = requireRun(runId);
		int surviving = Math.toIntExact(candidateRepository.countByRunIdAndKilledFalse(runId));
		if (run.getStatus() != RunStatus.COMPLETE) {
			run.setCompletedAt(LocalDateTime.now());
			logger.info("Completed run {} with {} of {} ZIPs surviving", runId, surviving, run.getTotalZips());
		}
		run.setStatus(RunStatus.COMPLETE);
		run.setSurvivingZips(surviving);
		run.setErrorMessage(null);
		return toDto(runRepository.save(run));
	}

	@Transactional
	public RunDto failRun(UUID runId, String error) {
		ScreeningRun run = requireRun(runId);
		run.setStatus(RunStatus.ERROR);
		run.setCompletedAt(LocalDateTime.now());
		run.setErrorMessage(sanitizeError(error));
		logger.warn("Run {} marked as failed: {}", runId, run.getErrorMessage());
		return toDto(runRepository.save(run));
	}

	@Transactional
	public StageLogEntryDto logStage(UUID runId, int stage, int inputCount, int outputCount) {
		return logStage(runId, stage, inputCount, outputCount, LocalDateTime.now(), StageStatus.COMPLETE);
	}

	/**
	 * Appends a stage log entry and moves the run's current stage forward. The current stage is
	 * never lowered when an earlier stage is re-run.
	 */
	@Transactional
	public StageLogEntryDto logStage(UUID runId, int stage, int inputCount, int outputCount,
									 LocalDateTime startedAt, StageStatus status) {
		if (stage < 0) {
			throw new IllegalArgumentException("stage must not be negative");
		}
		if (inputCount < 0 || outputCount < 0 || outputCount > inputCount) {
			throw new IllegalArgumentException("Invalid stage counts: input=" + inputCount + ", output=" + outputCount);
		}
		ScreeningRun run = requireRun(runId);

		StageLogEntry entry = new StageLogEntry();
		entry.setRunId(runId);
		entry.setStage(stage);
		entry.setStartedAt(startedAt == null ? LocalDateTime.now() : startedAt);
		entry.setCompletedAt(LocalDateTime.now());
		entry.setZipsInput(inputCount);
		entry.setZipsOutput(outputCount);
		entry.setZipsKilled(inputCount - outputCount);
		entry.setStatus(status == null ? StageStatus.COMPLETE : status);
		stageLogRepository.save(entry);

		if (run.getCurrentStage() == null || run.getCurrentStage() < stage) {
			run.setCurrentStage(stage);
		}
		run.setSurvivingZips(Math.toIntExact(candidateRepository.countByRunIdAndKilledFalse(runId)));
		runRepository.save(run);
		return toDto(entry);
	}

	public RunDto getRun(UUID runId) {
		return toDto(requireRun(runId));
	}

	public Page<RunDto> listRuns(RunStatus status, Pageable pageable) {
		return runRepository.search(status, pageable).map(this::toDto);
	}

	public List<StageLogEntryDto> stageLog(UUID runId) {
		requireRun(runId);
		return stageLogRepository.findByRunIdOrderByStartedAtAsc(runId).stream()
				.map(this::toDto)
				.toList();
	}

	public StageHistogramDto stageHistogram(UUID runId) {
		requireRun(runId);
		Map<Integer, Long> counts = new LinkedHashMap<>();
		long total = 0;
		for (Object[] row : candidateRepository.stageHistogram(runId)) {
			long count = ((Number) row[1]).longValue();
			counts.put(((Number) row[0]).intValue(), count);
			total += count;
		}
		return new StageHistogramDto(runId, counts, total);
	}

	public List<KillSummaryItemDto> killSummary(UUID runId) {
		requireRun(runId);
		return candidateRepository.killSummary(runId).stream()
				.map(row -> new KillSummaryItemDto(
						row[0] == null ? null : ((Number) row[0]).intValue(),
						(String) row[1],
						((Number) row[2]).longValue(),
						row[3] == null ? null : ((Number) row[3]).doubleValue()
				))
				.toList();
	}

	private ScreeningRun requireRun(UUID runId) {
		if (runId == null) {
			throw new IllegalArgumentException("runId is required");
		}
		return runRepository.findById(runId)
				.orElseThrow(() -> new IllegalArgumentException("Run not found: " + runId));
	}

	private List<String> normalizeStates(List<String> targetStates) {
		if (targetStates == null || targetStates.isEmpty()) {
			throw new ConfigurationException("At least one target state is required");
		}
		Set<String> states = new LinkedHashSet<>();
		List<String> invalid = new ArrayList<>();
		for (String raw : targetStates) {
			String state = raw == null ? "" : raw.trim().toUpperCase(Locale.ROOT);
			if (!STATE_CODE.matcher(state).matches()) {
				invalid.add(String.valueOf(raw));
				continue;
			}
			states.add(state);
		}
		if (!invalid.isEmpty()) {
			throw new ConfigurationException("Invalid state codes: " + invalid);
		}
		return List.copyOf(states);
	}

	private String sanitizeError(String error) {
		if (error == null) {
			return null;
		}
		String trimmed = error.replaceAll("[\\r\\n]+", " ").trim();
		if (trimmed.length() > ERROR_MAX_LENGTH) {
			return trimmed.substring(0, ERROR_MAX_LENGTH);
		}
		return trimmed.isEmpty() ? null : trimmed;
	}

	private RunDto toDto(ScreeningRun run) {
		return new RunDto(
				run.getRunId(),
				run.getCreatedAt(),
				run.getCreatedBy(),
				run.getTargetStates(),
				run.getConfig(),
				run.getStatus(),
				run.getCurrentStage(),
				run.getTotalZips(),
				run.getSurvivingZips(),
				run.getCompletedAt(),
				run.getErrorMessage()
		);
	}

	private StageLogEntryDto toDto(StageLogEntry entry) {
		return new StageLogEntryDto(
				entry.getStage(),
				entry.getStartedAt(),
				entry.getCompletedAt(),
				entry.getZipsInput(),
				entry.getZipsOutput(),
				entry.getZipsKilled(),
				entry.getStatus()
		);
	}
}
