package my.projectalpha.app.dto;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;

public record ValuationDto(Long id,
						   Long assetHubId,
						   String source,
						   String sourceLabel,
						   BigDecimal asisValue,
						   BigDecimal arvValue,
						   LocalDate valueDate,
						   BigDecimal rehabEstTotal,
						   Boolean recommendRehab,
						   String notes,
						   String links,
						   LocalDateTime createdAt,
						   LocalDateTime updatedAt) {
}
