package my.sitescreener.app.dto;

import java.time.LocalDateTime;

public record WeightProfileDto(
		Long id,
		String name,
		int version,
		String description,
		double financialWeight,
		double marketWeight,
		double trajectoryWeight,
		double catalystWeight,
		double regulationWeight,
		double yieldWeight,
		double cushionWeight,
		double breakevenWeight,
		double saturationWeight,
		double rentWeight,
		double demandWeight,
		double populationGrowthWeight,
		double incomeGrowthWeight,
		double housingGrowthWeight,
		double tierAThreshold,
		double tierBThreshold,
		double tierCThreshold,
		double tierDThreshold,
		double minYieldThreshold,
		double maxSaturationThreshold,
		double minCushionThreshold,
		boolean active,
		LocalDateTime createdAt,
		LocalDateTime updatedAt
) {
}
