package my.projectalpha.app.dto;

import java.util.List;

public record PipelineSummary(ValuationDocumentDto document,
							  ExtractedValuationDto valuation,
							  List<ExtractionFieldResultDto> fieldResults,
							  List<String> warnings,
							  String sourceUsed) {
}
