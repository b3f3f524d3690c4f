package my.projectalpha.app.dto;

import java.time.LocalDateTime;

public record SellerDto(Long id,
						String name,
						String broker,
						String email,
						String poc,
						LocalDateTime createdAt) {
}
