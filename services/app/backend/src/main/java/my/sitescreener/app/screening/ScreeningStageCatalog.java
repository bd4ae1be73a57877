package my.sitescreener.app.screening;

import my.sitescreener.app.config.AppProperties;
import my.sitescreener.app.provider.FactFields;
import my.sitescreener.app.provider.FactSet;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * Built-in screening stages. Stage 0 filters on geography, stage 1 on demographics.
 */
@Component
public class ScreeningStageCatalog {
	public static final int GEOGRAPHY_STAGE = 0;
	public static final int DEMOGRAPHICS_STAGE = 1;

	private static final List<String> COUNT_FIELDS = List.of(
			FactFields.POPULATION,
			FactFields.HOUSING_UNITS,
			FactFields.SFH_UNITS,
			FactFields.TOWNHOME_UNITS,
			FactFields.APARTMENT_UNITS,
			FactFields.MOBILE_HOME_UNITS
	);
	private static final List<String> RATE_FIELDS = List.of(
			FactFields.MEDIAN_INCOME,
			FactFields.POVERTY_RATE,
			FactFields.RENTER_PCT
	);

	private final AppProperties.Screening defaults;
	private final DriveTimeEstimator driveTimeEstimator;

	public ScreeningStageCatalog(AppProperties properties) {
		this.defaults = properties.screening();
		this.driveTimeEstimator = new DriveTimeEstimator(defaults.metros(), defaults.roadFactor(), defaults.averageSpeedMph());
	}

	public ScreeningThresholds thresholds(Map<String, Object> runConfig) {
		return ScreeningThresholds.resolve(defaults, runConfig);
	}

	/**
	 * @throws IllegalArgumentException for a stage index that is not defined
	 */
	public StageDefinition stage(int stage, Map<String, Object> runConfig) {
		ScreeningThresholds thresholds = thresholds(runConfig);
		return switch (stage) {
			case GEOGRAPHY_STAGE -> geography(thresholds);
			case DEMOGRAPHICS_STAGE -> demographics(thresholds);
			default -> throw new IllegalArgumentException("Unknown stage: " + stage);
		};
	}

	private StageDefinition geography(ScreeningThresholds thresholds) {
		List<KillSwitch> switches = List.of(
				new ThresholdKillSwitch("SS-S0-01", FactFields.DENSITY, ThresholdKillSwitch.Bound.MAX,
						thresholds.urbanDensityMax(), "Urban density %.0f/sq mi exceeds %.0f"),
				new MsaCoreKillSwitch("SS-S0-02", defaults.urbanCores(),
						defaults.msaCorePopulation(), defaults.msaCoreDensity()),
				new DriveTimeKillSwitch("SS-S0-03", driveTimeEstimator, thresholds.driveTimeMaxMin())
		);
		return new StageDefinition(GEOGRAPHY_STAGE, "geography", FactSet.GEOGRAPHY, switches, this::geographyMetrics);
	}

	private StageDefinition demographics(ScreeningThresholds thresholds) {
		List<KillSwitch> switches = List.of(
				new MissingDataKillSwitch("SS-S1-00", "No Census data available"),
				new ThresholdKillSwitch("SS-S1-01", FactFields.POPULATION, ThresholdKillSwitch.Bound.MIN,
						thresholds.minPopulation(), "Population %,.0f < %,.0f"),
				new ThresholdKillSwitch("SS-S1-02", FactFields.MEDIAN_INCOME, ThresholdKillSwitch.Bound.MIN,
						thresholds.minIncome(), "Income $%,.0f < $%,.0f"),
				new ThresholdKillSwitch("SS-S1-03", FactFields.POVERTY_RATE, ThresholdKillSwitch.Bound.MAX,
						thresholds.maxPovertyRate(), "Poverty %.1f%% > %.1f%%"),
				new ThresholdKillSwitch("SS-S1-04", FactFields.RENTER_PCT, ThresholdKillSwitch.Bound.MIN,
						thresholds.minRenterPct(), "Renter %.1f%% < %.1f%%")
		);
		return new StageDefinition(DEMOGRAPHICS_STAGE, "demographics", FactSet.DEMOGRAPHICS, switches, this::demographicMetrics);
	}

	private Map<String, Object> geographyMetrics(CandidateContext candidate) {
		Map<String, Object> metrics = new LinkedHashMap<>();
		candidate.facts().number(FactFields.DENSITY).ifPresent(density -> metrics.put(FactFields.DENSITY, density));
		OptionalDouble latitude = candidate.number(FactFields.LATITUDE);
		OptionalDouble longitude = candidate.number(FactFields.LONGITUDE);
		if (latitude.isPresent() && longitude.isPresent()) {
			driveTimeEstimator.nearest(latitude.getAsDouble(), longitude.getAsDouble()).ifPresent(driveTime -> {
				metrics.put(FactFields.DRIVE_TIME_MIN, Math.round(driveTime.minutes() * 10.0) / 10.0);
				metrics.put(FactFields.NEAREST_METRO, driveTime.metro());
			});
		}
		return metrics;
	}

	private Map<String, Object> demographicMetrics(CandidateContext candidate) {
		Map<String, Object> metrics = new LinkedHashMap<>();
		for (String field : COUNT_FIELDS) {
			candidate.facts().number(field).ifPresent(value -> metrics.put(field, Math.round(value)));
		}
		for (String field : RATE_FIELDS) {
			candidate.facts().number(field).ifPresent(value -> metrics.put(field, value));
		}
		return metrics;
	}
}
