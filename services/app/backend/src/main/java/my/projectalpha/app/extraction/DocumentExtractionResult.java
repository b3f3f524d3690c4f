package my.projectalpha.app.extraction;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

public record DocumentExtractionResult(String fileName,
									   String mimeType,
									   LocalDateTime extractedAt,
									   List<FieldExtractionRecord> fields,
									   Map<String, Object> valuationPayload,
									   List<Map<String, Object>> comparablesPayload,
									   List<Map<String, Object>> repairsPayload,
									   Map<String, Object> rawResponse,
									   List<String> warnings,
									   String inferredSource) {

	public static DocumentExtractionResult warningsOnly(String fileName, String mimeType, List<String> warnings) {
		return new DocumentExtractionResult(fileName, mimeType, LocalDateTime.now(), List.of(), Map.of(), List.of(),
				List.of(), Map.of(), warnings, null);
	}

	public boolean hasNoPayload() {
		return valuationPayload.isEmpty() && comparablesPayload.isEmpty() && repairsPayload.isEmpty();
	}

	public DocumentExtractionResult withFields(List<FieldExtractionRecord> records) {
		return new DocumentExtractionResult(fileName, mimeType, extractedAt, records, valuationPayload,
				comparablesPayload, repairsPayload, rawResponse, warnings, inferredSource);
	}
}
