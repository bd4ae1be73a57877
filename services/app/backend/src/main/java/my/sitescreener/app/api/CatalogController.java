package my.sitescreener.app.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import my.sitescreener.app.dto.CatalogImportResultDto;
import my.sitescreener.app.importer.ReferenceCatalogImporter;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

@RestController
@RequestMapping("/api/catalog")
@Tag(name = "Reference Catalog")
public class CatalogController {
	private final ReferenceCatalogImporter catalogImporter;

	public CatalogController(ReferenceCatalogImporter catalogImporter) {
		this.catalogImporter = catalogImporter;
	}

	@PostMapping(path = "/import", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
	@Operation(summary = "Upsert ZIP catalog rows from a CSV upload")
	public CatalogImportResultDto importCatalog(@RequestParam("file") MultipartFile file) {
		return catalogImporter.importCatalog(file);
	}
}
