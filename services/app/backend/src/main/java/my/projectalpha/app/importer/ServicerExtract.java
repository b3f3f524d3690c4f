package my.projectalpha.app.importer;

import java.util.List;

public record ServicerExtract(List<ServicerExtractRow> rows, List<RowError> errors, List<String> ignoredHeaders) {

	public record RowError(int row, String message) {
	}
}
