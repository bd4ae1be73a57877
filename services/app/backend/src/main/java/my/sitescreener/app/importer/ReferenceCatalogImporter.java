package my.sitescreener.app.importer;

import my.sitescreener.app.dto.CatalogImportResultDto;
import my.sitescreener.app.provider.CatalogEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Loads the ZIP catalog that defines the candidate universe of new runs. Rows are upserted by
 * ZIP; catalog rows missing from the upload are kept.
 */
@Service
public class ReferenceCatalogImporter {
	private static final Logger logger = LoggerFactory.getLogger(ReferenceCatalogImporter.class);
	private static final int BATCH_SIZE = 500;

	private final JdbcTemplate jdbcTemplate;
	private final ZipCatalogCsvParser parser;

	public ReferenceCatalogImporter(JdbcTemplate jdbcTemplate) {
		this.jdbcTemplate = jdbcTemplate;
		this.parser = new ZipCatalogCsvParser();
	}

	@Transactional
	public CatalogImportResultDto importCatalog(MultipartFile file) {
		if (file == null || file.isEmpty()) {
			throw new IllegalArgumentException("File is empty");
		}
		byte[] payload;
		try {
			payload = file.getBytes();
		} catch (IOException exc) {
			throw new IllegalArgumentException("Failed to read upload: " + exc.getMessage(), exc);
		}
		return importCatalog(payload);
	}

	@Transactional
	public CatalogImportResultDto importCatalog(byte[] payload) {
		ZipCatalogCsvParser.Result result = parser.parse(payload);
		List<CatalogEntry> entries = result.entries();
		Timestamp updatedAt = Timestamp.valueOf(LocalDateTime.now());
		jdbcTemplate.batchUpdate("""
				insert into zip_catalog (zip, state, county_fips, county_name, city, latitude, longitude,
				                         population, density, updated_at)
				values (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
				on conflict (zip) do update set
				    state = excluded.state,
				    county_fips = excluded.county_fips,
				    county_name = excluded.county_name,
				    city = excluded.city,
				    latitude = excluded.latitude,
				    longitude = excluded.longitude,
				    population = excluded.population,
				    density = excluded.density,
				    updated_at = excluded.updated_at
				""", entries, BATCH_SIZE, (ps, entry) -> {
			ps.setString(1, entry.zip());
			ps.setString(2, entry.state());
			ps.setString(3, entry.countyFips());
			ps.setString(4, entry.countyName());
			ps.setString(5, entry.city());
			ps.setObject(6, entry.latitude(), Types.DOUBLE);
			ps.setObject(7, entry.longitude(), Types.DOUBLE);
			ps.setObject(8, entry.population(), Types.INTEGER);
			ps.setObject(9, entry.density(), Types.DOUBLE);
			ps.setTimestamp(10, updatedAt);
		});
		if (result.rowsSkipped() > 0) {
			logger.warn("Catalog import skipped {} of {} rows", result.rowsSkipped(), result.rowsRead());
		}
		logger.info("Imported {} ZIP catalog rows", entries.size());
		return new CatalogImportResultDto(result.rowsRead(), entries.size(), result.rowsSkipped(), result.errors());
	}
}
