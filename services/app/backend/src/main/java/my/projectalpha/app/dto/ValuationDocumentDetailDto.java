package my.projectalpha.app.dto;

import java.util.List;

public record ValuationDocumentDetailDto(ValuationDocumentDto document,
										 List<ExtractionFieldResultDto> fieldResults,
										 List<ExtractionLogEntryDto> logEntries,
										 Long valuationId) {
}
