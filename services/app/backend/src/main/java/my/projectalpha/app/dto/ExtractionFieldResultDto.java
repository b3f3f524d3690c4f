package my.projectalpha.app.dto;

import java.math.BigDecimal;

public record ExtractionFieldResultDto(Long id,
									   String targetModel,
									   String targetField,
									   String valueText,
									   String valueJson,
									   BigDecimal confidence,
									   String extractionMethod,
									   boolean requiresReview) {
}
