package my.sitescreener.app.scoring;

import my.sitescreener.app.provider.FactFields;
import my.sitescreener.app.provider.FactRecord;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Turns a county fact record into scoring inputs, substituting neutral values for anything the
 * provider does not know.
 */
public class ScoringInputGatherer {
	static final double DEFAULT_YIELD = 0;
	static final double DEFAULT_CUSHION = 0;
	static final double DEFAULT_BREAKEVEN = 0;
	static final double DEFAULT_MARKET_RENT = 80;
	static final double DEFAULT_SATURATION = 10;
	static final double DEFAULT_DEMAND = 50;
	static final double DEFAULT_CATALYST = 0;
	static final double TRAJECTORY_GROWTH_FACTOR = 1.5;

	static final double NO_JURISDICTION_SCORE = 50;
	static final double UNRATED_JURISDICTION_SCORE = 60;
	private static final Map<String, Double> DIFFICULTY_SCORES = Map.of(
			"easy", 95.0,
			"moderate", 70.0,
			"difficult", 45.0,
			"very_difficult", 20.0
	);

	public ScoringInputs gather(FactRecord facts) {
		List<String> defaulted = new ArrayList<>();
		double yield = value(facts, FactFields.PROJECTED_YIELD, DEFAULT_YIELD, defaulted);
		double cushion = value(facts, FactFields.RENT_CUSHION, DEFAULT_CUSHION, defaulted);
		double breakeven = value(facts, FactFields.BREAKEVEN_RENT, DEFAULT_BREAKEVEN, defaulted);
		double marketRent = value(facts, FactFields.MARKET_RENT, DEFAULT_MARKET_RENT, defaulted);
		double saturation = value(facts, FactFields.SATURATION, DEFAULT_SATURATION, defaulted);
		double demand = value(facts, FactFields.DEMAND_SCORE, DEFAULT_DEMAND, defaulted);
		double growth = value(facts, FactFields.TRAJECTORY_SCORE, 0, defaulted) * TRAJECTORY_GROWTH_FACTOR;
		double catalyst = value(facts, FactFields.CATALYST_DEMAND_SQFT, DEFAULT_CATALYST, defaulted);
		double regulation = regulationScore(facts, defaulted);
		return new ScoringInputs(yield, cushion, breakeven, marketRent, saturation, demand,
				growth, growth, growth, catalyst, regulation, defaulted, facts.asOf().orElse(null));
	}

	double regulationScore(FactRecord facts, List<String> defaulted) {
		Optional<String> difficulty = facts.text(FactFields.JURISDICTION_DIFFICULTY);
		Object hasJurisdiction = facts.fields().get(FactFields.HAS_JURISDICTION);
		boolean known = Boolean.TRUE.equals(hasJurisdiction) || (hasJurisdiction == null && difficulty.isPresent());
		if (!known) {
			defaulted.add(FactFields.JURISDICTION_DIFFICULTY);
			return NO_JURISDICTION_SCORE;
		}
		if (difficulty.isEmpty()) {
			return UNRATED_JURISDICTION_SCORE;
		}
		return DIFFICULTY_SCORES.getOrDefault(difficulty.get().toLowerCase(Locale.ROOT), UNRATED_JURISDICTION_SCORE);
	}

	private double value(FactRecord facts, String field, double fallback, List<String> defaulted) {
		OptionalDouble value = facts.number(field);
		if (value.isPresent() && !Double.isNaN(value.getAsDouble())) {
			return value.getAsDouble();
		}
		defaulted.add(field);
		return fallback;
	}
}
