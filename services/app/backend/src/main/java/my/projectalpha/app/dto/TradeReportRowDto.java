package my.projectalpha.app.dto;

import java.math.BigDecimal;
import java.time.LocalDateTime;

public record TradeReportRowDto(Long tradeId,
								String tradeName,
								String sellerName,
								String status,
								LocalDateTime createdAt,
								long assetCount,
								BigDecimal totalUpb,
								BigDecimal avgUpb,
								BigDecimal avgLtv,
								BigDecimal totalDebt,
								BigDecimal asisValue) {
}
