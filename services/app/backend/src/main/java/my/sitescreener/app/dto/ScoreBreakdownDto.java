package my.sitescreener.app.dto;

import my.sitescreener.app.domain.Tier;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

/**
 * One county's score under one profile, with component weights, sub-scores and the raw inputs
 * (including which of them fell back to defaults).
 */
public record ScoreBreakdownDto(
		String countyFips,
		String state,
		String countyName,
		Long weightProfileId,
		String weightProfileName,
		double compositeScore,
		Tier tier,
		String recommendation,
		Integer marketRank,
		boolean hasFatalFlaw,
		List<String> fatalFlawReasons,
		List<ScoreComponentDto> components,
		Map<String, Object> rawInputs,
		Integer dataFreshnessDays,
		LocalDateTime scoredAt
) {
}
