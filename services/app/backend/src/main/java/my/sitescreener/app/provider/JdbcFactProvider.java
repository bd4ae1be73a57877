package my.sitescreener.app.provider;

import my.sitescreener.app.service.ProviderUnavailableException;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Component;

import java.sql.Date;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.LocalDate;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Reads the reference facts tables that the acquisition jobs fill. Never writes.
 */
@Component
public class JdbcFactProvider implements FactProvider {
	private final NamedParameterJdbcTemplate jdbcTemplate;

	public JdbcFactProvider(NamedParameterJdbcTemplate jdbcTemplate) {
		this.jdbcTemplate = jdbcTemplate;
	}

	@Override
	public List<String> findCandidateKeys(Collection<String> states) {
		if (states == null || states.isEmpty()) {
			return List.of();
		}
		List<String> normalized = states.stream()
				.map(state -> state.trim().toUpperCase(Locale.ROOT))
				.toList();
		try {
			return jdbcTemplate.queryForList("""
					select zip from zip_catalog
					where state in (:states)
					order by zip
					""", new MapSqlParameterSource("states", normalized), String.class);
		} catch (DataAccessException ex) {
			throw new ProviderUnavailableException(String.join(",", normalized), "Catalog lookup failed: " + ex.getMessage(), ex);
		}
	}

	@Override
	public Map<String, CatalogEntry> catalogEntries(Collection<String> zips) {
		Map<String, CatalogEntry> entries = new LinkedHashMap<>();
		if (zips == null || zips.isEmpty()) {
			return entries;
		}
		try {
			jdbcTemplate.query("""
					select zip, state, county_fips, county_name, city, latitude, longitude, population, density
					from zip_catalog
					where zip in (:zips)
					order by zip
					""", new MapSqlParameterSource("zips", List.copyOf(zips)), rs -> {
				CatalogEntry entry = new CatalogEntry(
						rs.getString("zip"),
						rs.getString("state"),
						rs.getString("county_fips"),
						rs.getString("county_name"),
						rs.getString("city"),
						getDouble(rs, "latitude"),
						getDouble(rs, "longitude"),
						getInteger(rs, "population"),
						getDouble(rs, "density")
				);
				entries.put(entry.zip(), entry);
			});
		} catch (DataAccessException ex) {
			throw new ProviderUnavailableException(null, "Catalog lookup failed: " + ex.getMessage(), ex);
		}
		return entries;
	}

	@Override
	public FactRecord lookupCandidate(String zip, FactSet factSet) {
		String sql = switch (factSet) {
			case GEOGRAPHY -> """
					select county_fips, city, latitude, longitude, population, density, null as as_of
					from zip_catalog
					where zip = :zip
					""";
			case DEMOGRAPHICS -> """
					select population, median_income, poverty_rate, renter_pct, housing_units,
					       sfh_units, townhome_units, apartment_units, mobile_home_units, as_of
					from zip_demographics
					where zip = :zip
					""";
		};
		return lookup(zip, sql, new MapSqlParameterSource("zip", zip));
	}

	@Override
	public FactRecord lookupAggregate(String countyFips) {
		return lookup(countyFips, """
				select projected_yield_pct, rent_cushion, breakeven_rent, market_rent,
				       saturation_sqft_per_capita, demand_score, trajectory_score, catalyst_demand_sqft,
				       has_jurisdiction, jurisdiction_difficulty, as_of
				from county_market_facts
				where county_fips = :countyFips
				""", new MapSqlParameterSource("countyFips", countyFips));
	}

	private FactRecord lookup(String key, String sql, MapSqlParameterSource params) {
		List<FactRecord> rows;
		try {
			rows = jdbcTemplate.query(sql, params, (rs, rowNum) -> toRecord(key, rs));
		} catch (DataAccessException ex) {
			throw new ProviderUnavailableException(key, "Fact lookup failed for " + key + ": " + ex.getMessage(), ex);
		}
		return rows.isEmpty() ? FactRecord.noData(key) : rows.get(0);
	}

	private FactRecord toRecord(String key, ResultSet rs) throws SQLException {
		Map<String, Object> fields = new LinkedHashMap<>();
		LocalDate asOf = null;
		int columns = rs.getMetaData().getColumnCount();
		for (int i = 1; i <= columns; i++) {
			String column = rs.getMetaData().getColumnLabel(i).toLowerCase(Locale.ROOT);
			Object value = rs.getObject(i);
			if ("as_of".equals(column)) {
				if (value instanceof Date date) {
					asOf = date.toLocalDate();
				} else if (value instanceof LocalDate localDate) {
					asOf = localDate;
				}
				continue;
			}
			if (value instanceof Number number) {
				fields.put(column, number.doubleValue());
			} else if (value != null) {
				fields.put(column, value instanceof Boolean ? value : value.toString());
			}
		}
		return FactRecord.of(key, fields, asOf);
	}

	private Double getDouble(ResultSet rs, String column) throws SQLException {
		double value = rs.getDouble(column);
		return rs.wasNull() ? null : value;
	}

	private Integer getInteger(ResultSet rs, String column) throws SQLException {
		int value = rs.getInt(column);
		return rs.wasNull() ? null : value;
	}
}
