package my.sitescreener.app.service;

import my.sitescreener.app.domain.CandidateRecord;
import my.sitescreener.app.domain.RunStatus;
import my.sitescreener.app.domain.ScreeningRun;
import my.sitescreener.app.domain.StageLogEntry;
import my.sitescreener.app.dto.RunDto;
import my.sitescreener.app.dto.StageHistogramDto;
import my.sitescreener.app.dto.StageLogEntryDto;
import my.sitescreener.app.provider.FactProvider;
import my.sitescreener.app.repository.CandidateRecordRepository;
import my.sitescreener.app.repository.ScreeningRunRepository;
import my.sitescreener.app.repository.StageLogRepository;
import my.sitescreener.app.screening.ScreeningStageCatalog;
import my.sitescreener.app.screening.ScreeningThresholds;
import my.sitescreener.app.support.TestProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RunRegistryServiceTest {
	@Mock
	private ScreeningRunRepository runRepository;

	@Mock
	private CandidateRecordRepository candidateRepository;

	@Mock
	private StageLogRepository stageLogRepository;

	@Mock
	private FactProvider factProvider;

	private RunRegistryService runRegistry;

	@BeforeEach
	void setUp() {
		runRegistry = new RunRegistryService(runRepository, candidateRepository, stageLogRepository, factProvider,
				new ScreeningStageCatalog(TestProperties.defaults()));
	}

	@Test
	void startRunCreatesOneCandidatePerZip() {
		List<String> zips = IntStream.range(0, 1201).mapToObj(i -> String.format("%05d", 24000 + i)).toList();
		when(factProvider.findCandidateKeys(List.of("WV", "VA"))).thenReturn(zips);

		RunDto run = runRegistry.startRun(List.of("wv", " VA", "WV"), Map.of(ScreeningThresholds.MIN_INCOME, 45000), "analyst");

		assertThat(run.status()).isEqualTo(RunStatus.RUNNING);
		assertThat(run.totalZips()).isEqualTo(1201);
		assertThat(run.survivingZips()).isEqualTo(1201);
		assertThat(run.targetStates()).containsExactly("WV", "VA");
		assertThat(run.config()).containsEntry(ScreeningThresholds.MIN_INCOME, 45000.0)
				.containsEntry(ScreeningThresholds.URBAN_DENSITY_MAX, 3500.0);
		@SuppressWarnings("unchecked")
		ArgumentCaptor<List<CandidateRecord>> captor = ArgumentCaptor.forClass(List.class);
		verify(candidateRepository, times(3)).saveAll(captor.capture());
		List<CandidateRecord> inserted = new ArrayList<>();
		captor.getAllValues().forEach(inserted::addAll);
		assertThat(inserted).hasSize(1201);
		assertThat(inserted).allMatch(record -> record.getStageReached() == CandidateRecord.NOT_STARTED && !record.isKilled());
	}

	@Test
	void startRunRejectsEmptyUniverse() {
		when(factProvider.findCandidateKeys(List.of("WV"))).thenReturn(List.of());

		assertThatThrownBy(() -> runRegistry.startRun(List.of("WV"), Map.of(), null))
				.isInstanceOf(ConfigurationException.class);
		verify(runRepository, never()).save(any());
		verify(candidateRepository, never()).saveAll(anyList());
	}

	@Test
	void startRunRejectsInvalidStates() {
		assertThatThrownBy(() -> runRegistry.startRun(List.of("West Virginia"), Map.of(), null))
				.isInstanceOf(ConfigurationException.class)
				.hasMessageContaining("West Virginia");
		assertThatThrownBy(() -> runRegistry.startRun(List.of(), Map.of(), null))
				.isInstanceOf(ConfigurationException.class);
	}

	@Test
	void completeRunIsIdempotent() {
		ScreeningRun run = run(RunStatus.RUNNING);
		when(runRepository.findById(run.getRunId())).thenReturn(Optional.of(run));
		when(runRepository.save(any(ScreeningRun.class))).thenAnswer(invocation -> invocation.getArgument(0));
		when(candidateRepository.countByRunIdAndKilledFalse(run.getRunId())).thenReturn(42L);

		RunDto first = runRegistry.completeRun(run.getRunId());
		RunDto second = runRegistry.completeRun(run.getRunId());

		assertThat(first.status()).isEqualTo(RunStatus.COMPLETE);
		assertThat(first.survivingZips()).isEqualTo(42);
		assertThat(second.completedAt()).isEqualTo(first.completedAt());
		assertThat(second.survivingZips()).isEqualTo(42);
	}

	@Test
	void failRunSanitizesError() {
		ScreeningRun run = run(RunStatus.RUNNING);
		when(runRepository.findById(run.getRunId())).thenReturn(Optional.of(run));
		when(runRepository.save(any(ScreeningRun.class))).thenAnswer(invocation -> invocation.getArgument(0));

		RunDto failed = runRegistry.failRun(run.getRunId(), "provider down\nretry later\r\n" + "x".repeat(3000));

		assertThat(failed.status()).isEqualTo(RunStatus.ERROR);
		assertThat(failed.errorMessage()).startsWith("provider down retry later x").hasSize(2000);
	}

	@Test
	void logStageNeverLowersCurrentStage() {
		ScreeningRun run = run(RunStatus.RUNNING);
		run.setCurrentStage(1);
		when(runRepository.findById(run.getRunId())).thenReturn(Optional.of(run));
		when(candidateRepository.countByRunIdAndKilledFalse(run.getRunId())).thenReturn(7L);

		StageLogEntryDto entry = runRegistry.logStage(run.getRunId(), 0, 10, 7);

		assertThat(entry.zipsKilled()).isEqualTo(3);
		assertThat(run.getCurrentStage()).isEqualTo(1);
		assertThat(run.getSurvivingZips()).isEqualTo(7);
		verify(stageLogRepository).save(any(StageLogEntry.class));
	}

	@Test
	void logStageRejectsInconsistentCounts() {
		assertThatThrownBy(() -> runRegistry.logStage(UUID.randomUUID(), 0, 5, 6))
				.isInstanceOf(IllegalArgumentException.class);
	}

	@Test
	void histogramSumsToTotal() {
		ScreeningRun run = run(RunStatus.RUNNING);
		when(runRepository.findById(run.getRunId())).thenReturn(Optional.of(run));
		when(candidateRepository.stageHistogram(run.getRunId())).thenReturn(List.of(
				new Object[]{-1, 3L},
				new Object[]{0, 2L},
				new Object[]{1, 5L}));

		StageHistogramDto histogram = runRegistry.stageHistogram(run.getRunId());

		assertThat(histogram.counts()).containsEntry(-1, 3L).containsEntry(1, 5L);
		assertThat(histogram.total()).isEqualTo(10L);
	}

	@Test
	void unknownRunIsRejected() {
		UUID runId = UUID.randomUUID();
		when(runRepository.findById(runId)).thenReturn(Optional.empty());

		assertThatThrownBy(() -> runRegistry.getRun(runId))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("Run not found");
	}

	private ScreeningRun run(RunStatus status) {
		ScreeningRun run = new ScreeningRun();
		run.setRunId(UUID.randomUUID());
		run.setCreatedAt(LocalDateTime.of(2026, 10, 1, 8, 0));
		run.setTargetStates(List.of("WV"));
		run.setConfig(Map.of());
		run.setStatus(status);
		run.setTotalZips(10);
		run.setSurvivingZips(10);
		return run;
	}
}
