package my.sitescreener.app.support;

import my.sitescreener.app.domain.CandidateRecord;
import my.sitescreener.app.repository.CandidateRecordRepository;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;

/**
 * Backs a mocked {@link CandidateRecordRepository} with a map of records for one run.
 */
public final class InMemoryCandidates {
	private final UUID runId;
	private final Map<String, CandidateRecord> records = new LinkedHashMap<>();

	public InMemoryCandidates(UUID runId) {
		this.runId = runId;
	}

	public CandidateRecord add(String zip) {
		CandidateRecord record = new CandidateRecord();
		record.setRunId(runId);
		record.setZip(zip);
		record.setCreatedAt(LocalDateTime.of(2026, 1, 1, 0, 0));
		record.setUpdatedAt(LocalDateTime.of(2026, 1, 1, 0, 0));
		records.put(zip, record);
		return record;
	}

	public CandidateRecord get(String zip) {
		return records.get(zip);
	}

	public List<CandidateRecord> all() {
		return List.copyOf(records.values());
	}

	public List<CandidateRecord> live() {
		return records.values().stream()
				.filter(record -> !record.isKilled())
				.sorted((a, b) -> a.getZip().compareTo(b.getZip()))
				.toList();
	}

	public void wire(CandidateRecordRepository repository) {
		lenient().when(repository.findByRunIdAndZip(eq(runId), anyString()))
				.thenAnswer(invocation -> Optional.ofNullable(records.get(invocation.<String>getArgument(1))));
		lenient().when(repository.findByRunIdAndKilledFalseOrderByZipAsc(runId))
				.thenAnswer(invocation -> live());
		lenient().when(repository.countByRunIdAndKilledFalse(runId))
				.thenAnswer(invocation -> (long) live().size());
		lenient().when(repository.save(any(CandidateRecord.class)))
				.thenAnswer(invocation -> invocation.getArgument(0));
	}
}
