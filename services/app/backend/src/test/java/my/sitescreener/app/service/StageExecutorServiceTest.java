package my.sitescreener.app.service;

import my.sitescreener.app.domain.CandidateRecord;
import my.sitescreener.app.domain.RunStatus;
import my.sitescreener.app.domain.StageStatus;
import my.sitescreener.app.dto.RunDto;
import my.sitescreener.app.dto.StageExecutionResult;
import my.sitescreener.app.provider.FactFields;
import my.sitescreener.app.provider.FactProvider;
import my.sitescreener.app.provider.FactRecord;
import my.sitescreener.app.provider.FactSet;
import my.sitescreener.app.repository.CandidateRecordRepository;
import my.sitescreener.app.repository.StageLogRepository;
import my.sitescreener.app.screening.ScreeningStageCatalog;
import my.sitescreener.app.support.InMemoryCandidates;
import my.sitescreener.app.support.TestProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.*;

class StageExecutorServiceTest {
	private final UUID runId = UUID.randomUUID();
	private RunRegistryService runRegistry;
	private CandidateRecordRepository candidateRepository;
	private StageLogRepository stageLogRepository;
	private FactProvider factProvider;
	private InMemoryCandidates candidates;
	private StageExecutorService executor;

	@BeforeEach
	void setUp() {
		runRegistry = mock(RunRegistryService.class);
		candidateRepository = mock(CandidateRecordRepository.class);
		stageLogRepository = mock(StageLogRepository.class);
		factProvider = mock(FactProvider.class);
		candidates = new InMemoryCandidates(runId);
		candidates.wire(candidateRepository);
		when(runRegistry.getRun(runId)).thenReturn(run(RunStatus.RUNNING));
		executor = new StageExecutorService(runRegistry, new CandidateStateService(candidateRepository),
				candidateRepository, stageLogRepository, new ScreeningStageCatalog(TestProperties.defaults()), factProvider);
	}

	@Test
	void geographyStageKillsDenseCandidates() {
		for (int i = 0; i < 10; i++) {
			String zip = String.format("2650%d", i);
			candidates.add(zip);
			double density = i < 3 ? 4000 + i * 100 : 800;
			when(factProvider.lookupCandidate(zip, FactSet.GEOGRAPHY))
					.thenReturn(FactRecord.of(zip, Map.of(FactFields.DENSITY, density)));
		}

		StageExecutionResult result = executor.executeStage(runId, 0);

		assertThat(result.input()).isEqualTo(10);
		assertThat(result.output()).isEqualTo(7);
		assertThat(result.killed()).isEqualTo(3);
		assertThat(result.killsByRule()).containsEntry("SS-S0-01", 3).containsEntry("SS-S0-02", 0);
		assertThat(result.status()).isEqualTo(StageStatus.COMPLETE);
		verify(runRegistry).logStage(eq(runId), eq(0), eq(10), eq(7), any(LocalDateTime.class), eq(StageStatus.COMPLETE));

		CandidateRecord killed = candidates.get("26500");
		assertThat(killed.isKilled()).isTrue();
		assertThat(killed.getKillStage()).isEqualTo(0);
		assertThat(killed.getKillRuleId()).isEqualTo("SS-S0-01");
		assertThat(killed.getKillValue()).isEqualTo(4000.0);
		assertThat(killed.getStageReached()).isEqualTo(CandidateRecord.NOT_STARTED);
		CandidateRecord survivor = candidates.get("26509");
		assertThat(survivor.getStageReached()).isEqualTo(0);
		assertThat(survivor.getMetrics()).containsEntry(FactFields.DENSITY, 800.0);
	}

	@Test
	void providerOutageLeavesCandidateUnresolved() {
		candidates.add("26501");
		candidates.add("26502");
		when(factProvider.lookupCandidate("26501", FactSet.GEOGRAPHY))
				.thenThrow(new ProviderUnavailableException("26501", "connection refused", null));
		when(factProvider.lookupCandidate("26502", FactSet.GEOGRAPHY))
				.thenReturn(FactRecord.of("26502", Map.of(FactFields.DENSITY, 300.0)));

		StageExecutionResult result = executor.executeStage(runId, 0);

		assertThat(result.unresolved()).isEqualTo(1);
		assertThat(result.advanced()).isEqualTo(1);
		assertThat(result.output()).isEqualTo(2);
		assertThat(result.status()).isEqualTo(StageStatus.PARTIAL);
		assertThat(candidates.get("26501").getStageReached()).isEqualTo(CandidateRecord.NOT_STARTED);
		assertThat(candidates.get("26501").isKilled()).isFalse();
	}

	@Test
	void rerunSkipsCandidatesAlreadyAdvanced() {
		candidates.add("26501").setStageReached(0);
		candidates.add("26502");
		when(factProvider.lookupCandidate("26502", FactSet.GEOGRAPHY))
				.thenReturn(FactRecord.of("26502", Map.of(FactFields.DENSITY, 300.0)));

		StageExecutionResult result = executor.executeStage(runId, 0);

		assertThat(result.alreadyAdvanced()).isEqualTo(1);
		assertThat(result.advanced()).isEqualTo(1);
		verify(factProvider, never()).lookupCandidate("26501", FactSet.GEOGRAPHY);
	}

	@Test
	void stageRequiresPreviousStageLog() {
		when(stageLogRepository.existsByRunIdAndStage(runId, 0)).thenReturn(false);

		assertThatThrownBy(() -> executor.executeStage(runId, 1))
				.isInstanceOf(PrecedenceViolationException.class)
				.hasMessageContaining("requires stage 0");
		verifyNoInteractions(factProvider);
	}

	@Test
	void stageRequiresRunningRun() {
		when(runRegistry.getRun(runId)).thenReturn(run(RunStatus.COMPLETE));

		assertThatThrownBy(() -> executor.executeStage(runId, 0))
				.isInstanceOf(PrecedenceViolationException.class);
		verify(runRegistry, never()).logStage(any(), anyInt(), anyInt(), anyInt(), any(), any());
	}

	@Test
	void demographicsStageKillsLowIncomeAfterGeography() {
		candidates.add("26241").setStageReached(0);
		candidates.add("26250").setStageReached(0);
		candidates.add("26260");
		when(stageLogRepository.existsByRunIdAndStage(runId, 0)).thenReturn(true);
		when(factProvider.lookupCandidate("26241", FactSet.DEMOGRAPHICS)).thenReturn(FactRecord.of("26241", Map.of(
				FactFields.POPULATION, 8200, FactFields.MEDIAN_INCOME, 36000, FactFields.POVERTY_RATE, 18.0,
				FactFields.RENTER_PCT, 30.0)));
		when(factProvider.lookupCandidate("26250", FactSet.DEMOGRAPHICS)).thenReturn(FactRecord.of("26250", Map.of(
				FactFields.POPULATION, 9100, FactFields.MEDIAN_INCOME, 51000, FactFields.POVERTY_RATE, 12.0,
				FactFields.RENTER_PCT, 28.0)));

		StageExecutionResult result = executor.executeStage(runId, 1);

		assertThat(result.killsByRule()).containsEntry("SS-S1-02", 1);
		assertThat(result.unresolved()).isEqualTo(1);
		assertThat(candidates.get("26241").getKillReason()).isEqualTo("Income $36,000 < $40,000");
		assertThat(candidates.get("26241").getStageReached()).isEqualTo(0);
		assertThat(candidates.get("26250").getStageReached()).isEqualTo(1);
		assertThat(candidates.get("26250").getMetrics()).containsEntry(FactFields.POPULATION, 9100L);
	}

	private RunDto run(RunStatus status) {
		return new RunDto(runId, LocalDateTime.now(), "tester", List.of("WV"), Map.of(), status, null, 10, 10, null, null);
	}
}
