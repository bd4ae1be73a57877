package my.sitescreener.app.service;

import my.sitescreener.app.config.AppProperties;
import my.sitescreener.app.domain.CandidateRecord;
import my.sitescreener.app.domain.ScoreRecord;
import my.sitescreener.app.dto.CandidateTierResultDto;
import my.sitescreener.app.provider.CatalogEntry;
import my.sitescreener.app.provider.FactProvider;
import my.sitescreener.app.repository.CandidateRecordRepository;
import my.sitescreener.app.repository.ScoreRecordRepository;
import my.sitescreener.app.repository.WeightProfileRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Carries county scores down to the surviving candidates of a run and splits the best of them
 * into tier 1 and tier 2.
 */
@Service
public class CandidateTierService {
	private static final Logger logger = LoggerFactory.getLogger(CandidateTierService.class);
	public static final int TIER_1 = 1;
	public static final int TIER_2 = 2;

	private final RunRegistryService runRegistry;
	private final WeightProfileRepository profileRepository;
	private final ScoreRecordRepository scoreRepository;
	private final CandidateRecordRepository candidateRepository;
	private final FactProvider factProvider;
	private final AppProperties.Scoring defaults;

	public CandidateTierService(RunRegistryService runRegistry,
								WeightProfileRepository profileRepository,
								ScoreRecordRepository scoreRepository,
								CandidateRecordRepository candidateRepository,
								FactProvider factProvider,
								AppProperties properties) {
		this.runRegistry = runRegistry;
		this.profileRepository = profileRepository;
		this.scoreRepository = scoreRepository;
		this.candidateRepository = candidateRepository;
		this.factProvider = factProvider;
		this.defaults = properties.scoring();
	}

	/**
	 * Each surviving candidate in a county with a non-fatal score takes that county's composite as
	 * its final score. Candidates are ranked by final score (ties by ZIP); the first
	 * {@code tier1Count} get tier 1 and the next {@code tier2Count} tier 2. Earlier tiers of the
	 * run are cleared first. Killed candidates are never touched.
	 */
	@Transactional
	public CandidateTierResultDto assignCandidateTiers(UUID runId, Long profileId, Integer tier1Count, Integer tier2Count) {
		runRegistry.getRun(runId);
		if (profileId == null || !profileRepository.existsById(profileId)) {
			throw new IllegalArgumentException("Weight profile not found: " + profileId);
		}
		int tier1 = tier1Count == null ? defaults.tier1Count() : tier1Count;
		int tier2 = tier2Count == null ? defaults.tier2Count() : tier2Count;
		if (tier1 < 0 || tier2 < 0) {
			throw new IllegalArgumentException("Tier counts must not be negative");
		}

		Map<String, Double> countyScores = new HashMap<>();
		for (ScoreRecord score : scoreRepository.findByWeightProfileIdOrderByCompositeScoreDesc(profileId)) {
			if (!score.hasFatalFlaw()) {
				countyScores.put(score.getCountyFips(), score.getCompositeScore());
			}
		}

		candidateRepository.clearTiers(runId);
		List<CandidateRecord> survivors = candidateRepository.findByRunIdAndKilledFalseOrderByZipAsc(runId);
		Map<String, CatalogEntry> catalog = factProvider.catalogEntries(survivors.stream().map(CandidateRecord::getZip).toList());

		List<CandidateRecord> scored = new ArrayList<>();
		for (CandidateRecord candidate : survivors) {
			CatalogEntry entry = catalog.get(candidate.getZip());
			Double score = entry == null ? null : countyScores.get(entry.countyFips());
			if (score != null) {
				candidate.setFinalScore(score);
				scored.add(candidate);
			}
		}
		scored.sort(Comparator.comparing(CandidateRecord::getFinalScore, Comparator.reverseOrder())
				.thenComparing(CandidateRecord::getZip));

		int assigned1 = 0;
		int assigned2 = 0;
		LocalDateTime now = LocalDateTime.now();
		for (int i = 0; i < scored.size(); i++) {
			CandidateRecord candidate = scored.get(i);
			candidate.setRank(i + 1);
			if (i < tier1) {
				candidate.setTier(TIER_1);
				assigned1++;
			} else if (i < tier1 + tier2) {
				candidate.setTier(TIER_2);
				assigned2++;
			} else {
				candidate.setTier(null);
			}
			candidate.setUpdatedAt(now);
		}
		candidateRepository.saveAll(scored);

		int unscored = survivors.size() - scored.size();
		logger.info("Run {}: ranked {} candidates with profile {} (tier 1: {}, tier 2: {}, unscored: {})",
				runId, scored.size(), profileId, assigned1, assigned2, unscored);
		return new CandidateTierResultDto(runId, profileId, scored.size(), assigned1, assigned2, unscored);
	}
}
