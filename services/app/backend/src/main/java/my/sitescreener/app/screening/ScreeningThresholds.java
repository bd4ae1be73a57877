package my.sitescreener.app.screening;

import my.sitescreener.app.config.AppProperties;
import my.sitescreener.app.service.ConfigurationException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Stage thresholds for one run: application defaults overridden by the run's config map.
 */
public record ScreeningThresholds(
		double urbanDensityMax,
		double driveTimeMaxMin,
		double minPopulation,
		double minIncome,
		double maxPovertyRate,
		double minRenterPct
) {
	public static final String URBAN_DENSITY_MAX = "urban_density_max";
	public static final String DRIVE_TIME_MAX_MIN = "drive_time_max_min";
	public static final String MIN_POPULATION = "min_population";
	public static final String MIN_INCOME = "min_income";
	public static final String MAX_POVERTY_RATE = "max_poverty_rate";
	public static final String MIN_RENTER_PCT = "min_renter_pct";

	public static ScreeningThresholds resolve(AppProperties.Screening defaults, Map<String, Object> config) {
		Map<String, Object> overrides = config == null ? Map.of() : config;
		List<String> errors = new ArrayList<>();
		ScreeningThresholds thresholds = new ScreeningThresholds(
				value(overrides, URBAN_DENSITY_MAX, defaults.urbanDensityMax(), errors),
				value(overrides, DRIVE_TIME_MAX_MIN, defaults.driveTimeMaxMin(), errors),
				value(overrides, MIN_POPULATION, defaults.minPopulation(), errors),
				value(overrides, MIN_INCOME, defaults.minIncome(), errors),
				value(overrides, MAX_POVERTY_RATE, defaults.maxPoverty(), errors),
				value(overrides, MIN_RENTER_PCT, defaults.minRenterPct(), errors)
		);
		if (!errors.isEmpty()) {
			throw new ConfigurationException("Invalid run config: " + String.join("; ", errors));
		}
		return thresholds;
	}

	public Map<String, Object> asConfig() {
		Map<String, Object> config = new LinkedHashMap<>();
		config.put(URBAN_DENSITY_MAX, urbanDensityMax);
		config.put(DRIVE_TIME_MAX_MIN, driveTimeMaxMin);
		config.put(MIN_POPULATION, minPopulation);
		config.put(MIN_INCOME, minIncome);
		config.put(MAX_POVERTY_RATE, maxPovertyRate);
		config.put(MIN_RENTER_PCT, minRenterPct);
		return config;
	}

	private static double value(Map<String, Object> overrides, String key, double fallback, List<String> errors) {
		Object raw = overrides.get(key);
		if (raw == null) {
			return fallback;
		}
		double parsed;
		if (raw instanceof Number number) {
			parsed = number.doubleValue();
		} else {
			try {
				parsed = Double.parseDouble(raw.toString().trim());
			} catch (NumberFormatException ex) {
				errors.add(key + " must be numeric");
				return fallback;
			}
		}
		if (Double.isNaN(parsed) || Double.isInfinite(parsed) || parsed < 0) {
			errors.add(key + " must be a non-negative number");
			return fallback;
		}
		return parsed;
	}
}
