package my.sitescreener.app.dto;

import com.fasterxml.jackson.annotation.JsonAlias;

/**
 * Weights and thresholds of a profile. The name comes from the path on upsert and from the body
 * on validation. The aliases cover the snake_case seed file.
 */
public record WeightProfileRequest(
		String name,
		String description,
		Double financialWeight,
		Double marketWeight,
		Double trajectoryWeight,
		Double catalystWeight,
		Double regulationWeight,
		Double yieldWeight,
		Double cushionWeight,
		Double breakevenWeight,
		Double saturationWeight,
		Double rentWeight,
		Double demandWeight,
		Double populationGrowthWeight,
		Double incomeGrowthWeight,
		Double housingGrowthWeight,
		@JsonAlias("tier_a_threshold") Double tierAThreshold,
		@JsonAlias("tier_b_threshold") Double tierBThreshold,
		@JsonAlias("tier_c_threshold") Double tierCThreshold,
		@JsonAlias("tier_d_threshold") Double tierDThreshold,
		Double minYieldThreshold,
		Double maxSaturationThreshold,
		Double minCushionThreshold,
		boolean activate
) {
}
