package my.sitescreener.app.dto;

import java.util.List;

public record ScoreComponentDto(
		String component,
		double weight,
		double score,
		List<SubScoreDto> subScores
) {
	public record SubScoreDto(String name, double weight, double score) {
	}
}
