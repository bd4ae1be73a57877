package my.sitescreener.app.scoring;

import my.sitescreener.app.domain.WeightProfile;
import my.sitescreener.app.support.TestProfiles;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class WeightProfileValidatorTest {
	private final WeightProfileValidator validator = new WeightProfileValidator(0.01);

	@Test
	void acceptsBalancedProfile() {
		assertThat(validator.validate(TestProfiles.balanced())).isEmpty();
	}

	@Test
	void rejectsNullProfile() {
		assertThat(validator.validate(null)).isNotEmpty();
	}

	@Test
	void acceptsSumWithinTolerance() {
		WeightProfile profile = TestProfiles.balanced();
		profile.setRegulationWeight(0.105);

		assertThat(validator.validate(profile)).isEmpty();
	}

	@Test
	void rejectsSumExactlyAtTolerance() {
		WeightProfile profile = TestProfiles.balanced();
		profile.setRegulationWeight(0.11);

		List<String> errors = validator.validate(profile);

		assertThat(errors).hasSize(1);
		assertThat(errors.get(0)).contains("component weights").contains("1.0100");
	}

	@Test
	void rejectsComponentSumOutsideTolerance() {
		WeightProfile profile = TestProfiles.balanced();
		profile.setRegulationWeight(0.15);

		List<String> errors = validator.validate(profile);

		assertThat(errors).hasSize(1);
		assertThat(errors.get(0)).contains("component weights").contains("1.0500");
	}

	@Test
	void reportsEverySubGroupIndependently() {
		WeightProfile profile = TestProfiles.balanced();
		profile.setYieldWeight(0.9);
		profile.setDemandWeight(0.0);

		List<String> errors = validator.validate(profile);

		assertThat(errors).anyMatch(e -> e.contains("financial sub-weights"));
		assertThat(errors).anyMatch(e -> e.contains("market sub-weights"));
		assertThat(errors).noneMatch(e -> e.contains("trajectory sub-weights"));
	}

	@Test
	void rejectsMissingAndOutOfRangeWeights() {
		WeightProfile profile = TestProfiles.balanced();
		profile.setMarketWeight(null);
		profile.setRentWeight(-0.35);

		List<String> errors = validator.validate(profile);

		assertThat(errors).anyMatch(e -> e.equals("marketWeight is required"));
		assertThat(errors).anyMatch(e -> e.equals("rentWeight must be between 0 and 1"));
	}

	@Test
	void rejectsTierThresholdsOutOfOrder() {
		WeightProfile profile = TestProfiles.balanced();
		profile.setTierCThreshold(65.0);

		List<String> errors = validator.validate(profile);

		assertThat(errors).containsExactly("tier thresholds must be strictly descending (A > B > C > D)");
	}

	@Test
	void requiresNameAndFatalThresholds() {
		WeightProfile profile = TestProfiles.balanced();
		profile.setName(" ");
		profile.setMinYieldThreshold(null);
		profile.setMinCushionThreshold(null);

		List<String> errors = validator.validate(profile);

		assertThat(errors).contains("name is required", "minYieldThreshold is required", "minCushionThreshold is required");
	}
}
