package my.projectalpha.app.dto;

import java.util.List;

public record TapeImportResult(Long sellerId,
							   Long tradeId,
							   String status,
							   int created,
							   int updated,
							   int skipped,
							   List<RowErrorDto> errors) {

	public record RowErrorDto(int row, String message) {
	}
}
