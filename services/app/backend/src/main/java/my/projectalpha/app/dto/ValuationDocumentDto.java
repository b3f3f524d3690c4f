package my.projectalpha.app.dto;

import java.time.LocalDateTime;

public record ValuationDocumentDto(Long id,
								   Long assetHubId,
								   String fileName,
								   String mimeType,
								   Long size,
								   LocalDateTime uploadedAt,
								   LocalDateTime processedAt,
								   String status,
								   String statusMessage,
								   String createdBy) {
}
