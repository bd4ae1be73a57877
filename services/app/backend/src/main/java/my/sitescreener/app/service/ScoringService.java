package my.sitescreener.app.service;

import my.sitescreener.app.config.AppProperties;
import my.sitescreener.app.domain.CountyAggregate;
import my.sitescreener.app.domain.ScoreRecord;
import my.sitescreener.app.domain.Tier;
import my.sitescreener.app.domain.WeightProfile;
import my.sitescreener.app.dto.ScoreBreakdownDto;
import my.sitescreener.app.dto.ScoreComponentDto;
import my.sitescreener.app.dto.ScoreComponentDto.SubScoreDto;
import my.sitescreener.app.dto.ScoreRecordDto;
import my.sitescreener.app.dto.ScoringResultDto;
import my.sitescreener.app.dto.TierSummaryItemDto;
import my.sitescreener.app.provider.FactProvider;
import my.sitescreener.app.provider.FactRecord;
import my.sitescreener.app.repository.CountyAggregateRepository;
import my.sitescreener.app.repository.ScoreRecordRepository;
import my.sitescreener.app.repository.WeightProfileRepository;
import my.sitescreener.app.scoring.RankAssigner;
import my.sitescreener.app.scoring.ScoreOutcome;
import my.sitescreener.app.scoring.ScoringEngine;
import my.sitescreener.app.scoring.ScoringInputGatherer;
import my.sitescreener.app.scoring.ScoringInputs;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Scores every passed county aggregate against a weight profile and answers leaderboard queries.
 */
@Service
public class ScoringService {
	private static final Logger logger = LoggerFactory.getLogger(ScoringService.class);

	private final WeightProfileRepository profileRepository;
	private final CountyAggregateRepository aggregateRepository;
	private final ScoreRecordRepository scoreRepository;
	private final FactProvider factProvider;
	private final ScoringInputGatherer gatherer;
	private final ScoringEngine engine;
	private final int defaultFreshnessDays;

	public ScoringService(WeightProfileRepository profileRepository,
						  CountyAggregateRepository aggregateRepository,
						  ScoreRecordRepository scoreRepository,
						  FactProvider factProvider,
						  AppProperties properties) {
		this.profileRepository = profileRepository;
		this.aggregateRepository = aggregateRepository;
		this.scoreRepository = scoreRepository;
		this.factProvider = factProvider;
		this.gatherer = new ScoringInputGatherer();
		this.engine = new ScoringEngine();
		this.defaultFreshnessDays = properties.scoring().defaultFreshnessDays();
	}

	/**
	 * Replaces the profile's score records. Counties without upstream market facts are skipped.
	 * Runs in one transaction, so a provider failure leaves the previous records in place.
	 */
	@Transactional
	public ScoringResultDto scoreAll(Long profileId) {
		WeightProfile profile = requireProfile(profileId);
		List<CountyAggregate> counties = aggregateRepository.findByPassedTrueOrderByCountyFipsAsc();
		LocalDateTime scoredAt = LocalDateTime.now();
		List<ScoreRecord> records = new ArrayList<>();
		int skipped = 0;
		for (CountyAggregate county : counties) {
			FactRecord facts = factProvider.lookupAggregate(county.getCountyFips());
			if (facts.isEmpty()) {
				skipped++;
				continue;
			}
			ScoringInputs inputs = gatherer.gather(facts);
			records.add(toRecord(county.getCountyFips(), profile, engine.score(inputs, profile), scoredAt));
		}
		RankAssigner.assign(records);

		scoreRepository.deleteByWeightProfileId(profile.getId());
		scoreRepository.saveAll(records);

		int fatal = (int) records.stream().filter(ScoreRecord::hasFatalFlaw).count();
		if (skipped > 0) {
			logger.warn("Scoring with profile {} v{} skipped {} counties without market facts",
					profile.getName(), profile.getVersion(), skipped);
		}
		logger.info("Scored {} counties with profile {} v{} ({} with fatal flaws)",
				records.size(), profile.getName(), profile.getVersion(), fatal);
		return new ScoringResultDto(profile.getId(), profile.getName(), profile.getVersion(),
				records.size(), fatal, skipped, scoredAt);
	}

	@Transactional
	public ScoringResultDto scoreAllActive() {
		WeightProfile active = profileRepository.findFirstByActiveTrueOrderByUpdatedAtDesc()
				.orElseThrow(() -> new IllegalArgumentException("No active weight profile"));
		return scoreAll(active.getId());
	}

	/**
	 * Ranked counties first in rank order, then counties with fatal flaws by composite score.
	 */
	public List<ScoreRecordDto> leaderboard(Long profileId) {
		requireProfile(profileId);
		Map<String, CountyAggregate> counties = aggregateRepository.findAll().stream()
				.collect(Collectors.toMap(CountyAggregate::getCountyFips, Function.identity()));
		return scoreRepository.findByWeightProfileIdOrderByCompositeScoreDesc(profileId).stream()
				.sorted(Comparator.comparing((ScoreRecord record) -> record.getMarketRank() == null)
						.thenComparing(ScoreRecord::getCompositeScore, Comparator.reverseOrder())
						.thenComparing(ScoreRecord::getCountyFips))
				.map(record -> toDto(record, counties.get(record.getCountyFips())))
				.toList();
	}

	public ScoreBreakdownDto breakdown(Long profileId, String countyFips) {
		WeightProfile profile = requireProfile(profileId);
		ScoreRecord record = scoreRepository.findByWeightProfileIdAndCountyFips(profileId, countyFips)
				.orElseThrow(() -> new IllegalArgumentException(
						"No score for county " + countyFips + " under weight profile " + profileId));
		CountyAggregate county = aggregateRepository.findById(countyFips).orElse(null);
		List<ScoreComponentDto> components = List.of(
				new ScoreComponentDto("financial", profile.getFinancialWeight(), record.getFinancialScore(), List.of(
						new SubScoreDto("yield", profile.getYieldWeight(), record.getYieldScore()),
						new SubScoreDto("cushion", profile.getCushionWeight(), record.getCushionScore()),
						new SubScoreDto("breakeven", profile.getBreakevenWeight(), record.getBreakevenScore()))),
				new ScoreComponentDto("market", profile.getMarketWeight(), record.getMarketScore(), List.of(
						new SubScoreDto("saturation", profile.getSaturationWeight(), record.getSaturationScore()),
						new SubScoreDto("rent", profile.getRentWeight(), record.getRentScore()),
						new SubScoreDto("demand", profile.getDemandWeight(), record.getDemandScore()))),
				new ScoreComponentDto("trajectory", profile.getTrajectoryWeight(), record.getTrajectoryScore(), List.of(
						new SubScoreDto("population_growth", profile.getPopulationGrowthWeight(), record.getPopulationGrowthScore()),
						new SubScoreDto("income_growth", profile.getIncomeGrowthWeight(), record.getIncomeGrowthScore()),
						new SubScoreDto("housing_growth", profile.getHousingGrowthWeight(), record.getHousingGrowthScore()))),
				new ScoreComponentDto("catalyst", profile.getCatalystWeight(), record.getCatalystScore(), List.of()),
				new ScoreComponentDto("regulation", profile.getRegulationWeight(), record.getRegulationScore(), List.of())
		);
		return new ScoreBreakdownDto(
				record.getCountyFips(),
				county == null ? null : county.getState(),
				county == null ? null : county.getCountyName(),
				profile.getId(),
				profile.getName(),
				record.getCompositeScore(),
				record.getTier(),
				record.getRecommendation().getLabel(),
				record.getMarketRank(),
				record.hasFatalFlaw(),
				record.getFatalFlawReasons(),
				components,
				record.getRawInputs(),
				record.getDataFreshnessDays(),
				record.getScoredAt()
		);
	}

	public List<TierSummaryItemDto> tierSummary(Long profileId) {
		requireProfile(profileId);
		return scoreRepository.tierSummary(profileId).stream()
				.map(row -> new TierSummaryItemDto(
						(Tier) row[0],
						((Number) row[1]).longValue(),
						row[2] == null ? null : ((Number) row[2]).doubleValue(),
						row[3] == null ? null : ((Number) row[3]).doubleValue(),
						row[4] == null ? null : ((Number) row[4]).doubleValue()
				))
				.toList();
	}

	private WeightProfile requireProfile(Long profileId) {
		if (profileId == null) {
			throw new IllegalArgumentException("profileId is required");
		}
		return profileRepository.findById(profileId)
				.orElseThrow(() -> new IllegalArgumentException("Weight profile not found: " + profileId));
	}

	private ScoreRecord toRecord(String countyFips, WeightProfile profile, ScoreOutcome outcome, LocalDateTime scoredAt) {
		ScoreRecord record = new ScoreRecord();
		record.setCountyFips(countyFips);
		record.setWeightProfileId(profile.getId());
		record.setRawInputs(outcome.inputs().snapshot());
		record.setYieldScore(outcome.subScores().yield());
		record.setCushionScore(outcome.subScores().cushion());
		record.setBreakevenScore(outcome.subScores().breakeven());
		record.setSaturationScore(outcome.subScores().saturation());
		record.setRentScore(outcome.subScores().rent());
		record.setDemandScore(outcome.subScores().demand());
		record.setPopulationGrowthScore(outcome.subScores().populationGrowth());
		record.setIncomeGrowthScore(outcome.subScores().incomeGrowth());
		record.setHousingGrowthScore(outcome.subScores().housingGrowth());
		record.setFinancialScore(outcome.components().financial());
		record.setMarketScore(outcome.components().market());
		record.setTrajectoryScore(outcome.components().trajectory());
		record.setCatalystScore(outcome.components().catalyst());
		record.setRegulationScore(outcome.components().regulation());
		record.setCompositeScore(outcome.components().composite());
		record.setHasFatalFlaw(outcome.hasFatalFlaw());
		record.setFatalFlawReasons(new ArrayList<>(outcome.fatalFlawReasons()));
		record.setTier(outcome.tier());
		record.setRecommendation(outcome.recommendation());
		record.setScoredAt(scoredAt);
		record.setDataFreshnessDays(freshnessDays(outcome.inputs().asOf()));
		return record;
	}

	private int freshnessDays(LocalDate asOf) {
		if (asOf == null) {
			return defaultFreshnessDays;
		}
		return (int) Math.max(0, ChronoUnit.DAYS.between(asOf, LocalDate.now()));
	}

	private ScoreRecordDto toDto(ScoreRecord record, CountyAggregate county) {
		return new ScoreRecordDto(
				record.getCountyFips(),
				county == null ? null : county.getState(),
				county == null ? null : county.getCountyName(),
				record.getFinancialScore(),
				record.getMarketScore(),
				record.getTrajectoryScore(),
				record.getCatalystScore(),
				record.getRegulationScore(),
				record.getCompositeScore(),
				record.hasFatalFlaw(),
				record.getFatalFlawReasons(),
				record.getTier(),
				record.getRecommendation().getLabel(),
				record.getMarketRank(),
				record.getDataFreshnessDays(),
				record.getScoredAt()
		);
	}
}
