package my.projectalpha.app.dto;

public record MilestoneDto(String outcomeType, String currentTask, String upcomingTask) {
}
