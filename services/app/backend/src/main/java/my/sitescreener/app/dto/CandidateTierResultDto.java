package my.sitescreener.app.dto;

import java.util.UUID;

public record CandidateTierResultDto(
		UUID runId,
		Long profileId,
		int ranked,
		int tier1,
		int tier2,
		int unscored
) {
}
