package my.projectalpha.app.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.math.BigDecimal;
import java.time.LocalDate;

public record ValuationUpsertRequest(
		@NotNull Long assetHubId,
		@NotBlank String source,
		BigDecimal asisValue,
		BigDecimal arvValue,
		@NotNull LocalDate valueDate,
		BigDecimal rehabEstTotal,
		Boolean recommendRehab,
		String notes,
		@Size(max = 500) String links
) {
}
