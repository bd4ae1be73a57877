package my.sitescreener.app.scoring;

import my.sitescreener.app.domain.WeightProfile;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

public class WeightProfileValidator {
	// absorbs binary rounding so that a sum of exactly 1 +/- tolerance is rejected
	private static final double EPSILON = 1e-9;

	private final double tolerance;

	public WeightProfileValidator(double tolerance) {
		this.tolerance = tolerance;
	}

	public List<String> validate(WeightProfile profile) {
		List<String> errors = new ArrayList<>();
		if (profile == null) {
			errors.add("Weight profile is empty");
			return errors;
		}
		if (profile.getName() == null || profile.getName().isBlank()) {
			errors.add("name is required");
		}

		checkGroup(errors, "component weights",
				new String[]{"financialWeight", "marketWeight", "trajectoryWeight", "catalystWeight", "regulationWeight"},
				profile.getFinancialWeight(), profile.getMarketWeight(), profile.getTrajectoryWeight(),
				profile.getCatalystWeight(), profile.getRegulationWeight());
		checkGroup(errors, "financial sub-weights",
				new String[]{"yieldWeight", "cushionWeight", "breakevenWeight"},
				profile.getYieldWeight(), profile.getCushionWeight(), profile.getBreakevenWeight());
		checkGroup(errors, "market sub-weights",
				new String[]{"saturationWeight", "rentWeight", "demandWeight"},
				profile.getSaturationWeight(), profile.getRentWeight(), profile.getDemandWeight());
		checkGroup(errors, "trajectory sub-weights",
				new String[]{"populationGrowthWeight", "incomeGrowthWeight", "housingGrowthWeight"},
				profile.getPopulationGrowthWeight(), profile.getIncomeGrowthWeight(), profile.getHousingGrowthWeight());

		Double[] tiers = {profile.getTierAThreshold(), profile.getTierBThreshold(),
				profile.getTierCThreshold(), profile.getTierDThreshold()};
		String[] tierNames = {"tierAThreshold", "tierBThreshold", "tierCThreshold", "tierDThreshold"};
		boolean tiersPresent = true;
		for (int i = 0; i < tiers.length; i++) {
			if (tiers[i] == null) {
				errors.add(tierNames[i] + " is required");
				tiersPresent = false;
			} else if (tiers[i] < 0 || tiers[i] > 100) {
				errors.add(tierNames[i] + " must be between 0 and 100");
			}
		}
		if (tiersPresent) {
			for (int i = 1; i < tiers.length; i++) {
				if (!(tiers[i - 1] > tiers[i])) {
					errors.add("tier thresholds must be strictly descending (A > B > C > D)");
					break;
				}
			}
		}

		if (profile.getMinYieldThreshold() == null) {
			errors.add("minYieldThreshold is required");
		}
		if (profile.getMaxSaturationThreshold() == null) {
			errors.add("maxSaturationThreshold is required");
		}
		if (profile.getMinCushionThreshold() == null) {
			errors.add("minCushionThreshold is required");
		}
		return errors;
	}

	private void checkGroup(List<String> errors, String label, String[] names, Double... weights) {
		boolean complete = true;
		double sum = 0;
		for (int i = 0; i < weights.length; i++) {
			Double weight = weights[i];
			if (weight == null) {
				errors.add(names[i] + " is required");
				complete = false;
				continue;
			}
			if (weight < 0 || weight > 1) {
				errors.add(names[i] + " must be between 0 and 1");
			}
			sum += weight;
		}
		if (complete && Math.abs(sum - 1.0) >= tolerance - EPSILON) {
			errors.add(String.format(Locale.US, "%s must sum to 1.0 (got %.4f for %s)",
					label, sum, Arrays.toString(weights)));
		}
	}
}
