package my.sitescreener.app.service;

import my.sitescreener.app.domain.CandidateRecord;
import my.sitescreener.app.repository.CandidateRecordRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * The only writer of per-candidate screening state. Both operations leave a killed record
 * untouched, so replaying a stage is safe.
 */
@Service
public class CandidateStateService {
	private final CandidateRecordRepository candidateRepository;

	public CandidateStateService(CandidateRecordRepository candidateRepository) {
		this.candidateRepository = candidateRepository;
	}

	/**
	 * @return {@code true} when the record was killed by this call
	 */
	@Transactional
	public boolean killCandidate(UUID runId, String zip, int stage, String ruleId, String reason,
								 Double threshold, Double observedValue) {
		if (ruleId == null || ruleId.isBlank()) {
			throw new IllegalArgumentException("ruleId is required");
		}
		CandidateRecord record = requireCandidate(runId, zip);
		if (record.isKilled()) {
			return false;
		}
		record.setKilled(true);
		record.setKillStage(stage);
		record.setKillRuleId(ruleId);
		record.setKillReason(reason);
		record.setKillThreshold(threshold);
		record.setKillValue(observedValue);
		record.setStageReached(Math.max(CandidateRecord.NOT_STARTED, stage - 1));
		record.setUpdatedAt(LocalDateTime.now());
		candidateRepository.save(record);
		return true;
	}

	/**
	 * Merges {@code delta} into the record's metrics (existing keys are overwritten) and raises
	 * {@code stageReached} to {@code stage}.
	 *
	 * @return {@code false} when the record is killed and nothing changed
	 */
	@Transactional
	public boolean mergeMetrics(UUID runId, String zip, int stage, Map<String, Object> delta) {
		validateMetrics(delta);
		CandidateRecord record = requireCandidate(runId, zip);
		if (record.isKilled()) {
			return false;
		}
		Map<String, Object> merged = new LinkedHashMap<>();
		if (record.getMetrics() != null) {
			merged.putAll(record.getMetrics());
		}
		if (delta != null) {
			merged.putAll(delta);
		}
		record.setMetrics(merged);
		if (stage > record.getStageReached()) {
			record.setStageReached(stage);
		}
		record.setUpdatedAt(LocalDateTime.now());
		candidateRepository.save(record);
		return true;
	}

	private CandidateRecord requireCandidate(UUID runId, String zip) {
		return candidateRepository.findByRunIdAndZip(runId, zip)
				.orElseThrow(() -> new IllegalArgumentException("Candidate not found: run=" + runId + ", zip=" + zip));
	}

	private void validateMetrics(Map<String, Object> delta) {
		if (delta == null) {
			return;
		}
		for (Map.Entry<String, Object> entry : delta.entrySet()) {
			if (entry.getKey() == null || entry.getKey().isBlank()) {
				throw new IllegalArgumentException("Metric names must not be blank");
			}
			Object value = entry.getValue();
			if (!(value instanceof Number || value instanceof Boolean || value instanceof String)) {
				throw new IllegalArgumentException("Metric " + entry.getKey() + " must be a number, boolean or string");
			}
		}
	}
}
