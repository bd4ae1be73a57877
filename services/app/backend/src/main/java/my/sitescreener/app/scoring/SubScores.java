package my.sitescreener.app.scoring;

public record SubScores(
		double yield,
		double cushion,
		double breakeven,
		double saturation,
		double rent,
		double demand,
		double populationGrowth,
		double incomeGrowth,
		double housingGrowth,
		double catalyst,
		double regulation
) {
}
