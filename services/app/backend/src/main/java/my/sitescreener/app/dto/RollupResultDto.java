package my.sitescreener.app.dto;

import java.time.LocalDateTime;
import java.util.UUID;

public record RollupResultDto(
		UUID runId,
		int counties,
		int passedCounties,
		int failedCounties,
		int unmappedZips,
		LocalDateTime builtAt
) {
}
