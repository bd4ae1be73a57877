package my.sitescreener.app.scoring;

import my.sitescreener.app.domain.ScoreRecord;

import java.util.Comparator;
import java.util.List;

/**
 * Dense ranking by composite score over the records without a fatal flaw. Equal composites share
 * a rank and the next distinct composite gets the next integer. Fatal records get no rank.
 */
public final class RankAssigner {
	private RankAssigner() {
	}

	public static void assign(List<ScoreRecord> records) {
		List<ScoreRecord> rankable = records.stream()
				.filter(record -> !record.hasFatalFlaw())
				.sorted(Comparator.comparing(ScoreRecord::getCompositeScore, Comparator.reverseOrder())
						.thenComparing(ScoreRecord::getCountyFips))
				.toList();
		records.stream()
				.filter(ScoreRecord::hasFatalFlaw)
				.forEach(record -> record.setMarketRank(null));
		int rank = 0;
		Double previous = null;
		for (ScoreRecord record : rankable) {
			if (previous == null || Double.compare(record.getCompositeScore(), previous) != 0) {
				rank++;
				previous = record.getCompositeScore();
			}
			record.setMarketRank(rank);
		}
	}
}
