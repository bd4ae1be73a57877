package my.sitescreener.app.scoring;

public record ComponentScores(
		double financial,
		double market,
		double trajectory,
		double catalyst,
		double regulation,
		double composite
) {
}
