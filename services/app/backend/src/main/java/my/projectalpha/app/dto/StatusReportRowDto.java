package my.projectalpha.app.dto;

import java.math.BigDecimal;

public record StatusReportRowDto(String status,
								 String statusLabel,
								 long tradeCount,
								 long assetCount,
								 BigDecimal totalUpb,
								 BigDecimal avgLtv,
								 BigDecimal percentOfTotalUpb) {
}
