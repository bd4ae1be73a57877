package my.sitescreener.app.scoring;

import my.sitescreener.app.domain.Recommendation;
import my.sitescreener.app.domain.Tier;

import java.util.List;

public record ScoreOutcome(
		ScoringInputs inputs,
		SubScores subScores,
		ComponentScores components,
		List<String> fatalFlawReasons,
		Tier tier,
		Recommendation recommendation
) {
	public ScoreOutcome {
		fatalFlawReasons = List.copyOf(fatalFlawReasons);
	}

	public boolean hasFatalFlaw() {
		return !fatalFlawReasons.isEmpty();
	}
}
