package my.sitescreener.app.scoring;

import my.sitescreener.app.provider.FactFields;
import my.sitescreener.app.provider.FactRecord;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ScoringInputGathererTest {
	private final ScoringInputGatherer gatherer = new ScoringInputGatherer();

	@Test
	void readsProvidedFacts() {
		Map<String, Object> fields = new HashMap<>();
		fields.put(FactFields.PROJECTED_YIELD, 12.5);
		fields.put(FactFields.RENT_CUSHION, 18.0);
		fields.put(FactFields.BREAKEVEN_RENT, 70.0);
		fields.put(FactFields.MARKET_RENT, 95.0);
		fields.put(FactFields.SATURATION, 6.5);
		fields.put(FactFields.DEMAND_SCORE, 64.0);
		fields.put(FactFields.TRAJECTORY_SCORE, 2.0);
		fields.put(FactFields.CATALYST_DEMAND_SQFT, 12000.0);
		fields.put(FactFields.HAS_JURISDICTION, true);
		fields.put(FactFields.JURISDICTION_DIFFICULTY, "Moderate");
		FactRecord facts = FactRecord.of("54039", fields, LocalDate.of(2026, 9, 1));

		ScoringInputs inputs = gatherer.gather(facts);

		assertThat(inputs.projectedYieldPct()).isEqualTo(12.5);
		assertThat(inputs.marketRent()).isEqualTo(95.0);
		assertThat(inputs.populationGrowth()).isEqualTo(3.0);
		assertThat(inputs.housingGrowth()).isEqualTo(3.0);
		assertThat(inputs.regulationScore()).isEqualTo(70.0);
		assertThat(inputs.defaulted()).isEmpty();
		assertThat(inputs.asOf()).isEqualTo(LocalDate.of(2026, 9, 1));
		assertThat(inputs.snapshot()).containsEntry("raw_projected_yield", 12.5)
				.containsEntry("as_of", "2026-09-01");
	}

	@Test
	void substitutesNeutralDefaults() {
		FactRecord facts = FactRecord.of("54039", Map.of(FactFields.PROJECTED_YIELD, 11.0));

		ScoringInputs inputs = gatherer.gather(facts);

		assertThat(inputs.marketRent()).isEqualTo(80.0);
		assertThat(inputs.saturation()).isEqualTo(10.0);
		assertThat(inputs.demandScore()).isEqualTo(50.0);
		assertThat(inputs.populationGrowth()).isEqualTo(0.0);
		assertThat(inputs.regulationScore()).isEqualTo(50.0);
		assertThat(inputs.defaulted()).contains(FactFields.MARKET_RENT, FactFields.SATURATION,
				FactFields.JURISDICTION_DIFFICULTY);
		assertThat(inputs.defaulted()).doesNotContain(FactFields.PROJECTED_YIELD);
	}

	@Test
	void unratedJurisdictionScoresSixty() {
		FactRecord facts = FactRecord.of("54039", Map.of(FactFields.HAS_JURISDICTION, true));

		assertThat(gatherer.gather(facts).regulationScore()).isEqualTo(60.0);
	}
}
