package my.projectalpha.app.dto;

import java.time.LocalDate;
import java.time.LocalDateTime;

public record OutcomeTaskDto(Long id,
							 Long outcomeId,
							 Long assetHubId,
							 String outcomeType,
							 String taskType,
							 String taskLabel,
							 LocalDate taskStarted,
							 String notes,
							 LocalDateTime createdAt) {
}
