package my.sitescreener.app.scoring;

import my.sitescreener.app.domain.Recommendation;
import my.sitescreener.app.domain.Tier;
import my.sitescreener.app.domain.WeightProfile;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import static my.sitescreener.app.scoring.SubScoreTransforms.round2;

/**
 * Stateless county scoring: normalize, combine, check fatal flaws, classify. Ranking needs the
 * whole population and lives in {@link RankAssigner}.
 */
public class ScoringEngine {
	public ScoreOutcome score(ScoringInputs inputs, WeightProfile profile) {
		SubScores subScores = normalize(inputs);
		ComponentScores components = combine(subScores, profile);
		List<String> fatalFlaws = fatalFlaws(inputs, profile);
		Tier tier = classify(components.composite(), !fatalFlaws.isEmpty(), profile);
		return new ScoreOutcome(inputs, subScores, components, fatalFlaws, tier,
				Recommendation.of(tier, !fatalFlaws.isEmpty()));
	}

	public SubScores normalize(ScoringInputs inputs) {
		return new SubScores(
				SubScoreTransforms.yield(inputs.projectedYieldPct()),
				SubScoreTransforms.cushion(inputs.rentCushion()),
				SubScoreTransforms.breakeven(inputs.breakevenRent(), inputs.marketRent()),
				SubScoreTransforms.saturation(inputs.saturation()),
				SubScoreTransforms.rent(inputs.marketRent()),
				SubScoreTransforms.demand(inputs.demandScore()),
				SubScoreTransforms.populationGrowth(inputs.populationGrowth()),
				SubScoreTransforms.incomeGrowth(inputs.incomeGrowth()),
				SubScoreTransforms.housingGrowth(inputs.housingGrowth()),
				SubScoreTransforms.catalyst(inputs.catalystDemandSqft()),
				SubScoreTransforms.regulation(inputs.regulationScore())
		);
	}

	public ComponentScores combine(SubScores s, WeightProfile profile) {
		double financial = round2(s.yield() * profile.getYieldWeight()
				+ s.cushion() * profile.getCushionWeight()
				+ s.breakeven() * profile.getBreakevenWeight());
		double market = round2(s.saturation() * profile.getSaturationWeight()
				+ s.rent() * profile.getRentWeight()
				+ s.demand() * profile.getDemandWeight());
		double trajectory = round2(s.populationGrowth() * profile.getPopulationGrowthWeight()
				+ s.incomeGrowth() * profile.getIncomeGrowthWeight()
				+ s.housingGrowth() * profile.getHousingGrowthWeight());
		double composite = round2(financial * profile.getFinancialWeight()
				+ market * profile.getMarketWeight()
				+ trajectory * profile.getTrajectoryWeight()
				+ s.catalyst() * profile.getCatalystWeight()
				+ s.regulation() * profile.getRegulationWeight());
		return new ComponentScores(financial, market, trajectory, s.catalyst(), s.regulation(), composite);
	}

	/**
	 * Every violated threshold adds one reason naming the observed value and the threshold.
	 */
	public List<String> fatalFlaws(ScoringInputs inputs, WeightProfile profile) {
		List<String> reasons = new ArrayList<>();
		if (inputs.projectedYieldPct() < profile.getMinYieldThreshold()) {
			reasons.add(String.format(Locale.US, "Yield %.1f%% below minimum %.1f%%",
					inputs.projectedYieldPct(), profile.getMinYieldThreshold()));
		}
		if (inputs.saturation() > profile.getMaxSaturationThreshold()) {
			reasons.add(String.format(Locale.US, "Saturation %.1f exceeds maximum %.1f",
					inputs.saturation(), profile.getMaxSaturationThreshold()));
		}
		if (inputs.rentCushion() < profile.getMinCushionThreshold()) {
			reasons.add(String.format(Locale.US, "Rent cushion $%.0f below minimum $%.0f",
					inputs.rentCushion(), profile.getMinCushionThreshold()));
		}
		return reasons;
	}

	public Tier classify(double composite, boolean fatalFlaw, WeightProfile profile) {
		if (fatalFlaw) {
			return Tier.F;
		}
		if (composite >= profile.getTierAThreshold()) {
			return Tier.A;
		}
		if (composite >= profile.getTierBThreshold()) {
			return Tier.B;
		}
		if (composite >= profile.getTierCThreshold()) {
			return Tier.C;
		}
		if (composite >= profile.getTierDThreshold()) {
			return Tier.D;
		}
		return Tier.F;
	}
}
