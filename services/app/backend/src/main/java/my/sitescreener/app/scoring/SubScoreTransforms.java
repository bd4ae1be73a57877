package my.sitescreener.app.scoring;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Piecewise-linear mappings from raw market inputs to 0..100 sub-scores. Every result is clamped
 * to [0, 100] and rounded to two decimals.
 */
public final class SubScoreTransforms {
	private SubScoreTransforms() {
	}

	/** Projected stabilized yield in percent: 15+ scores 100, 10 scores 50, under 5 scores 0. */
	public static double yield(double yieldPct) {
		double score;
		if (yieldPct >= 15) {
			score = 100;
		} else if (yieldPct >= 10) {
			score = 50 + (yieldPct - 10) * 10;
		} else if (yieldPct >= 5) {
			score = (yieldPct - 5) * 10;
		} else {
			score = 0;
		}
		return clampRound(score);
	}

	/** Rent cushion per unit in dollars; negative cushions are penalized twice as hard. */
	public static double cushion(double cushion) {
		double score;
		if (cushion >= 30) {
			score = 100;
		} else if (cushion >= 0) {
			score = 50 + cushion / 30 * 50;
		} else {
			score = 50 + cushion * 2;
		}
		return clampRound(score);
	}

	public static double breakeven(double breakevenRent, double marketRent) {
		if (marketRent <= 0) {
			return clampRound(50);
		}
		return clampRound(100 - breakevenRent / marketRent * 50);
	}

	/** Storage square feet per capita: 6 or less scores 100, above 15 scores 0. */
	public static double saturation(double sqftPerCapita) {
		double score;
		if (sqftPerCapita <= 6) {
			score = 100;
		} else if (sqftPerCapita <= 10) {
			score = 100 - (sqftPerCapita - 6) * 12.5;
		} else if (sqftPerCapita <= 15) {
			score = 50 - (sqftPerCapita - 10) * 10;
		} else {
			score = 0;
		}
		return clampRound(score);
	}

	/** Market rent for a 10x10 unit in dollars. */
	public static double rent(double marketRent) {
		double score;
		if (marketRent >= 100) {
			score = 100;
		} else if (marketRent >= 60) {
			score = 40 + (marketRent - 60) * 1.5;
		} else {
			score = marketRent * 0.67;
		}
		return clampRound(score);
	}

	public static double demand(double demandScore) {
		return clampRound(demandScore);
	}

	public static double populationGrowth(double growth) {
		return clampRound(50 + growth * 25);
	}

	public static double incomeGrowth(double growth) {
		return clampRound(50 + growth * 16.67);
	}

	public static double housingGrowth(double growth) {
		return clampRound(50 + growth * 16.67);
	}

	/** Storage demand in square feet added by announced catalysts; no catalyst still scores 25. */
	public static double catalyst(double demandSqft) {
		double score;
		if (demandSqft >= 50000) {
			score = 100;
		} else if (demandSqft >= 25000) {
			score = 75 + (demandSqft - 25000) / 25000 * 25;
		} else if (demandSqft >= 10000) {
			score = 50 + (demandSqft - 10000) / 15000 * 25;
		} else if (demandSqft > 0) {
			score = 25 + demandSqft / 10000 * 25;
		} else {
			score = 25;
		}
		return clampRound(score);
	}

	public static double regulation(double regulationScore) {
		return clampRound(regulationScore);
	}

	static double clampRound(double value) {
		if (Double.isNaN(value)) {
			return 0;
		}
		return round2(Math.max(0, Math.min(100, value)));
	}

	static double round2(double value) {
		return BigDecimal.valueOf(value).setScale(2, RoundingMode.HALF_UP).doubleValue();
	}
}
