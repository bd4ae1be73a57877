package my.sitescreener.app.importer;

import my.sitescreener.app.dto.CatalogImportResultDto;
import my.sitescreener.app.provider.CatalogEntry;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.ParameterizedPreparedStatementSetter;
import org.springframework.mock.web.MockMultipartFile;

import java.nio.charset.StandardCharsets;
import java.util.Collection;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.*;

class ReferenceCatalogImporterTest {
	@Test
	@SuppressWarnings("unchecked")
	void upsertsParsedRows() {
		JdbcTemplate jdbcTemplate = mock(JdbcTemplate.class);
		ReferenceCatalogImporter importer = new ReferenceCatalogImporter(jdbcTemplate);
		String csv = "zip,state,county_fips\n26201,WV,54097\n26202,WV,54097\nbad,WV,54097\n";

		CatalogImportResultDto result = importer.importCatalog(
				new MockMultipartFile("file", "catalog.csv", "text/csv", csv.getBytes(StandardCharsets.UTF_8)));

		assertThat(result.rowsRead()).isEqualTo(3);
		assertThat(result.rowsImported()).isEqualTo(2);
		assertThat(result.rowsSkipped()).isEqualTo(1);
		ArgumentCaptor<String> sql = ArgumentCaptor.forClass(String.class);
		ArgumentCaptor<Collection<CatalogEntry>> rows = ArgumentCaptor.forClass(Collection.class);
		verify(jdbcTemplate).batchUpdate(sql.capture(), rows.capture(), eq(500), any(ParameterizedPreparedStatementSetter.class));
		assertThat(sql.getValue()).contains("on conflict (zip) do update");
		assertThat(rows.getValue()).extracting(CatalogEntry::zip).containsExactly("26201", "26202");
	}

	@Test
	void rejectsEmptyUpload() {
		ReferenceCatalogImporter importer = new ReferenceCatalogImporter(mock(JdbcTemplate.class));

		assertThatThrownBy(() -> importer.importCatalog(new MockMultipartFile("file", new byte[0])))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("empty");
	}
}
