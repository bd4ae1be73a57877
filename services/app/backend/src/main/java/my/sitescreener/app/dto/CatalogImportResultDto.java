package my.sitescreener.app.dto;

import java.util.List;

public record CatalogImportResultDto(int rowsRead, int rowsImported, int rowsSkipped, List<String> errors) {
}
