package my.projectalpha.app.dto;

import java.time.LocalDateTime;
import java.util.Map;

public record OutcomeDto(Long id,
						 Long assetHubId,
						 String outcomeType,
						 String outcomeLabel,
						 Map<String, Object> fields,
						 LocalDateTime createdAt,
						 LocalDateTime updatedAt) {
}
