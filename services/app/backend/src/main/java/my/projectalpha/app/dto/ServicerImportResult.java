package my.projectalpha.app.dto;

import java.util.List;

/**
 * Outcome of a servicer extract upload. {@code unmatched} counts rows stored without an asset hub.
 */
public record ServicerImportResult(Long fileId,
								   String status,
								   int created,
								   int updated,
								   int unmatched,
								   List<TapeImportResult.RowErrorDto> errors) {
}
