package my.projectalpha.app.importer;

import java.util.List;

public record SellerTape(List<SellerTapeRow> rows, List<RowError> errors, List<String> ignoredHeaders) {

	public record RowError(int row, String message) {
	}
}
