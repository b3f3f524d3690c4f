package my.projectalpha.app.dto;

import java.math.BigDecimal;

public record ReportingSummaryDto(BigDecimal totalUpb, long assetCount, BigDecimal avgLtv, BigDecimal delinquencyRate) {
}
