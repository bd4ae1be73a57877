package my.sitescreener.app.provider;

/**
 * One row of the reference ZIP catalog. Numeric fields are null when unknown.
 */
public record CatalogEntry(
		String zip,
		String state,
		String countyFips,
		String countyName,
		String city,
		Double latitude,
		Double longitude,
		Integer population,
		Double density
) {
}
