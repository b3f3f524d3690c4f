package my.projectalpha.app.dto;

import java.time.LocalDateTime;

public record OutcomeAuditDto(Long id,
							  Long assetHubId,
							  String outcomeType,
							  String field,
							  String oldValue,
							  String newValue,
							  String editedBy,
							  LocalDateTime editedAt,
							  String source) {
}
