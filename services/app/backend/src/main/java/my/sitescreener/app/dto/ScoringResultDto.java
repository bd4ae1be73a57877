package my.sitescreener.app.dto;

import java.time.LocalDateTime;

public record ScoringResultDto(
		Long profileId,
		String profileName,
		int profileVersion,
		int scored,
		int fatal,
		int skippedWithoutFacts,
		LocalDateTime scoredAt
) {
}
