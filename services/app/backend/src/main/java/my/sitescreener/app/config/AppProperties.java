package my.sitescreener.app.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.List;

@Validated
@ConfigurationProperties(prefix = "app")
public record AppProperties(
		@Valid @NotNull Screening screening,
		@Valid @NotNull Rollup rollup,
		@Valid @NotNull Scoring scoring
) {
	public record Screening(
			@Positive double urbanDensityMax,
			@Positive double driveTimeMaxMin,
			@PositiveOrZero double minPopulation,
			@PositiveOrZero double minIncome,
			@PositiveOrZero double maxPoverty,
			@PositiveOrZero double minRenterPct,
			@Positive double msaCorePopulation,
			@Positive double msaCoreDensity,
			@Positive double roadFactor,
			@Positive double averageSpeedMph,
			List<String> urbanCores,
			@Valid @NotEmpty List<Metro> metros
	) {
		public record Metro(
				@NotNull String name,
				double latitude,
				double longitude
		) {
		}
	}

	public record Rollup(
			@Positive double countyDensityMax
	) {
	}

	public record Scoring(
			@Positive double weightTolerance,
			@PositiveOrZero int tier1Count,
			@PositiveOrZero int tier2Count,
			@PositiveOrZero int defaultFreshnessDays
	) {
	}
}
