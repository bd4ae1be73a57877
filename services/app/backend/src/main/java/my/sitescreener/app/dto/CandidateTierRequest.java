package my.sitescreener.app.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

public record CandidateTierRequest(@NotNull Long profileId, @PositiveOrZero Integer tier1Count, @PositiveOrZero Integer tier2Count) {
}
