package my.sitescreener.app.provider;

/**
 * Field names shared between the fact provider, the kill switches, candidate metrics and the
 * scoring input snapshot.
 */
public final class FactFields {
	public static final String COUNTY_FIPS = "county_fips";
	public static final String CITY = "city";
	public static final String LATITUDE = "latitude";
	public static final String LONGITUDE = "longitude";
	public static final String POPULATION = "population";
	public static final String DENSITY = "density";
	public static final String DRIVE_TIME_MIN = "drive_time_min";
	public static final String NEAREST_METRO = "nearest_metro";

	public static final String MEDIAN_INCOME = "median_income";
	public static final String POVERTY_RATE = "poverty_rate";
	public static final String RENTER_PCT = "renter_pct";
	public static final String HOUSING_UNITS = "housing_units";
	public static final String SFH_UNITS = "sfh_units";
	public static final String TOWNHOME_UNITS = "townhome_units";
	public static final String APARTMENT_UNITS = "apartment_units";
	public static final String MOBILE_HOME_UNITS = "mobile_home_units";

	public static final String PROJECTED_YIELD = "projected_yield_pct";
	public static final String RENT_CUSHION = "rent_cushion";
	public static final String BREAKEVEN_RENT = "breakeven_rent";
	public static final String MARKET_RENT = "market_rent";
	public static final String SATURATION = "saturation_sqft_per_capita";
	public static final String DEMAND_SCORE = "demand_score";
	public static final String TRAJECTORY_SCORE = "trajectory_score";
	public static final String CATALYST_DEMAND_SQFT = "catalyst_demand_sqft";
	public static final String HAS_JURISDICTION = "has_jurisdiction";
	public static final String JURISDICTION_DIFFICULTY = "jurisdiction_difficulty";

	private FactFields() {
	}
}
