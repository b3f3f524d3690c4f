package my.projectalpha.app.dto;

import java.time.LocalDate;

public record OutcomeTaskRequest(Long outcomeId, String taskType, LocalDate taskStarted, String notes) {
}
