package my.sitescreener.app.scoring;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Raw inputs for one county after neutral defaults were applied. {@code defaulted} names the
 * inputs that were missing upstream.
 */
public record ScoringInputs(
		double projectedYieldPct,
		double rentCushion,
		double breakevenRent,
		double marketRent,
		double saturation,
		double demandScore,
		double populationGrowth,
		double incomeGrowth,
		double housingGrowth,
		double catalystDemandSqft,
		double regulationScore,
		List<String> defaulted,
		LocalDate asOf
) {
	public ScoringInputs {
		defaulted = defaulted == null ? List.of() : List.copyOf(defaulted);
	}

	public Map<String, Object> snapshot() {
		Map<String, Object> snapshot = new LinkedHashMap<>();
		snapshot.put("raw_projected_yield", projectedYieldPct);
		snapshot.put("raw_rent_cushion", rentCushion);
		snapshot.put("raw_breakeven_rent", breakevenRent);
		snapshot.put("raw_market_rent", marketRent);
		snapshot.put("raw_saturation_ratio", saturation);
		snapshot.put("raw_demand_score", demandScore);
		snapshot.put("raw_population_growth", populationGrowth);
		snapshot.put("raw_income_growth", incomeGrowth);
		snapshot.put("raw_housing_growth", housingGrowth);
		snapshot.put("raw_catalyst_impact", catalystDemandSqft);
		snapshot.put("raw_regulation_score", regulationScore);
		snapshot.put("defaulted_inputs", defaulted);
		if (asOf != null) {
			snapshot.put("as_of", asOf.toString());
		}
		return snapshot;
	}
}
