package my.sitescreener.app.scoring;

import my.sitescreener.app.domain.Recommendation;
import my.sitescreener.app.domain.Tier;
import my.sitescreener.app.domain.WeightProfile;
import my.sitescreener.app.support.TestProfiles;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ScoringEngineTest {
	private final ScoringEngine engine = new ScoringEngine();

	@Test
	void combineWeightsComponentsIntoComposite() {
		WeightProfile profile = TestProfiles.balanced();
		profile.setFinancialWeight(0.5);
		profile.setMarketWeight(0.5);
		profile.setTrajectoryWeight(0.0);
		profile.setCatalystWeight(0.0);
		profile.setRegulationWeight(0.0);
		profile.setYieldWeight(1.0);
		profile.setCushionWeight(0.0);
		profile.setBreakevenWeight(0.0);
		profile.setSaturationWeight(1.0);
		profile.setRentWeight(0.0);
		profile.setDemandWeight(0.0);
		profile.setPopulationGrowthWeight(1.0);
		profile.setIncomeGrowthWeight(0.0);
		profile.setHousingGrowthWeight(0.0);
		SubScores subScores = new SubScores(100, 0, 0, 0, 70, 70, 60, 60, 60, 25, 50);

		ComponentScores components = engine.combine(subScores, profile);

		assertThat(components.financial()).isEqualTo(100.0);
		assertThat(components.market()).isEqualTo(0.0);
		assertThat(components.composite()).isEqualTo(50.0);
	}

	@Test
	void lowYieldIsFatal() {
		ScoringInputs inputs = inputs(8, 20, 50, 110, 7);

		ScoreOutcome outcome = engine.score(inputs, TestProfiles.balanced());

		assertThat(outcome.hasFatalFlaw()).isTrue();
		assertThat(outcome.fatalFlawReasons()).hasSize(1);
		assertThat(outcome.fatalFlawReasons().get(0)).contains("8").contains("10");
		assertThat(outcome.tier()).isEqualTo(Tier.F);
		assertThat(outcome.recommendation()).isEqualTo(Recommendation.AVOID);
		assertThat(outcome.recommendation().getLabel()).isEqualTo("avoid");
	}

	@Test
	void collectsEveryViolatedThreshold() {
		ScoringInputs inputs = inputs(8, -5, 50, 80, 13);

		List<String> reasons = engine.fatalFlaws(inputs, TestProfiles.balanced());

		assertThat(reasons).hasSize(3);
		assertThat(reasons).anyMatch(reason -> reason.startsWith("Saturation 13.0"));
		assertThat(reasons).anyMatch(reason -> reason.startsWith("Rent cushion $-5"));
	}

	@Test
	void strongMarketClassifiesAsStrongPursue() {
		ScoringInputs inputs = new ScoringInputs(16, 40, 40, 120, 5, 90, 2, 3, 3, 60000, 95, List.of(), null);

		ScoreOutcome outcome = engine.score(inputs, TestProfiles.balanced());

		assertThat(outcome.hasFatalFlaw()).isFalse();
		assertThat(outcome.components().composite()).isGreaterThanOrEqualTo(80.0);
		assertThat(outcome.tier()).isEqualTo(Tier.A);
		assertThat(outcome.recommendation()).isEqualTo(Recommendation.STRONG_PURSUE);
	}

	@Test
	void classifyUsesInclusiveLowerBounds() {
		WeightProfile profile = TestProfiles.balanced();

		assertThat(engine.classify(80.0, false, profile)).isEqualTo(Tier.A);
		assertThat(engine.classify(79.99, false, profile)).isEqualTo(Tier.B);
		assertThat(engine.classify(65.0, false, profile)).isEqualTo(Tier.B);
		assertThat(engine.classify(50.0, false, profile)).isEqualTo(Tier.C);
		assertThat(engine.classify(35.0, false, profile)).isEqualTo(Tier.D);
		assertThat(engine.classify(34.99, false, profile)).isEqualTo(Tier.F);
		assertThat(engine.classify(99.0, true, profile)).isEqualTo(Tier.F);
	}

	@Test
	void scoringIsDeterministic() {
		ScoringInputs inputs = inputs(12, 10, 60, 95, 8);
		WeightProfile profile = TestProfiles.balanced();

		ScoreOutcome first = engine.score(inputs, profile);
		ScoreOutcome second = engine.score(inputs, profile);

		assertThat(second).isEqualTo(first);
	}

	private ScoringInputs inputs(double yield, double cushion, double breakeven, double rent, double saturation) {
		return new ScoringInputs(yield, cushion, breakeven, rent, saturation, 50, 0, 0, 0, 0, 50, List.of(), null);
	}
}
