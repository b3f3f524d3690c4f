package my.projectalpha.app.dto;

import java.time.LocalDateTime;

public record ExtractionLogEntryDto(Long id, String level, String message, LocalDateTime createdAt) {
}
