package my.sitescreener.app.dto;

import my.sitescreener.app.domain.Tier;

import java.time.LocalDateTime;
import java.util.List;

public record ScoreRecordDto(
		String countyFips,
		String state,
		String countyName,
		double financialScore,
		double marketScore,
		double trajectoryScore,
		double catalystScore,
		double regulationScore,
		double compositeScore,
		boolean hasFatalFlaw,
		List<String> fatalFlawReasons,
		Tier tier,
		String recommendation,
		Integer marketRank,
		Integer dataFreshnessDays,
		LocalDateTime scoredAt
) {
}
