package my.sitescreener.app.importer;

import my.sitescreener.app.provider.CatalogEntry;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;

import java.io.IOException;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Parses the reference ZIP catalog export. Required columns are {@code zip}, {@code state} and
 * {@code county_fips}; the others may be blank. Rows that fail validation are reported and
 * skipped; a later row for the same ZIP replaces an earlier one.
 */
public class ZipCatalogCsvParser {
	private static final Pattern ZIP_RE = Pattern.compile("^\\d{5}$");
	private static final Pattern STATE_RE = Pattern.compile("^[A-Z]{2}$");
	private static final Pattern FIPS_RE = Pattern.compile("^\\d{5}$");
	private static final int MAX_REPORTED_ERRORS = 50;

	public Result parse(byte[] payload) {
		String content = decode(payload);
		Map<String, CatalogEntry> entries = new LinkedHashMap<>();
		List<String> errors = new ArrayList<>();
		int rowsRead = 0;
		int rowsSkipped = 0;
		CSVFormat format = CSVFormat.DEFAULT.builder()
				.setDelimiter(detectDelimiter(content))
				.setHeader()
				.setSkipHeaderRecord(true)
				.setIgnoreHeaderCase(true)
				.setTrim(true)
				.build();
		try (CSVParser parser = CSVParser.parse(new StringReader(content), format)) {
			for (String column : List.of("zip", "state", "county_fips")) {
				if (!parser.getHeaderMap().containsKey(column)) {
					throw new IllegalArgumentException("Catalog CSV is missing column " + column);
				}
			}
			for (CSVRecord record : parser) {
				rowsRead++;
				try {
					CatalogEntry entry = toEntry(record);
					entries.put(entry.zip(), entry);
				} catch (IllegalArgumentException ex) {
					rowsSkipped++;
					if (errors.size() < MAX_REPORTED_ERRORS) {
						errors.add("line " + record.getRecordNumber() + ": " + ex.getMessage());
					}
				}
			}
		} catch (IOException exc) {
			throw new IllegalArgumentException("Failed to read catalog CSV: " + exc.getMessage(), exc);
		}
		return new Result(List.copyOf(entries.values()), rowsRead, rowsSkipped, errors);
	}

	private CatalogEntry toEntry(CSVRecord record) {
		String zip = padZip(get(record, "zip"));
		if (!ZIP_RE.matcher(zip).matches()) {
			throw new IllegalArgumentException("invalid zip '" + zip + "'");
		}
		String state = get(record, "state").toUpperCase(Locale.ROOT);
		if (!STATE_RE.matcher(state).matches()) {
			throw new IllegalArgumentException("invalid state '" + state + "'");
		}
		String countyFips = get(record, "county_fips");
		if (!FIPS_RE.matcher(countyFips).matches()) {
			throw new IllegalArgumentException("invalid county_fips '" + countyFips + "'");
		}
		Double population = parseNumber(record, "population");
		return new CatalogEntry(
				zip,
				state,
				countyFips,
				blankToNull(get(record, "county_name")),
				blankToNull(get(record, "city")),
				parseNumber(record, "latitude"),
				parseNumber(record, "longitude"),
				population == null ? null : (int) Math.round(population),
				parseNumber(record, "density")
		);
	}

	private String get(CSVRecord record, String column) {
		if (!record.isMapped(column) || !record.isSet(column)) {
			return "";
		}
		String value = record.get(column);
		return value == null ? "" : value.trim();
	}

	private Double parseNumber(CSVRecord record, String column) {
		String raw = get(record, column).replace(",", "");
		if (raw.isBlank()) {
			return null;
		}
		try {
			return Double.parseDouble(raw);
		} catch (NumberFormatException exc) {
			throw new IllegalArgumentException("invalid " + column + " '" + raw + "'");
		}
	}

	private String padZip(String zip) {
		if (zip.length() >= 3 && zip.length() < 5 && zip.chars().allMatch(Character::isDigit)) {
			return "0".repeat(5 - zip.length()) + zip;
		}
		return zip;
	}

	private String blankToNull(String value) {
		return value == null || value.isBlank() ? null : value;
	}

	private char detectDelimiter(String content) {
		int lineEnd = content.indexOf('\n');
		String header = lineEnd < 0 ? content : content.substring(0, lineEnd);
		return header.contains(";") && !header.contains(",") ? ';' : ',';
	}

	private String decode(byte[] payload) {
		if (payload == null || payload.length == 0) {
			throw new IllegalArgumentException("Catalog CSV is empty");
		}
		String decoded = new String(payload, StandardCharsets.UTF_8);
		if (!decoded.isEmpty() && decoded.charAt(0) == '\uFEFF') {
			return decoded.substring(1);
		}
		return decoded;
	}

	public record Result(List<CatalogEntry> entries, int rowsRead, int rowsSkipped, List<String> errors) {
	}
}
