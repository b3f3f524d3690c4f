package my.projectalpha.app.dto;

import java.time.LocalDateTime;

public record TradeDto(Long id,
					   Long sellerId,
					   String sellerName,
					   String tradeName,
					   String status,
					   String statusLabel,
					   LocalDateTime createdAt,
					   LocalDateTime updatedAt) {
}
