package my.projectalpha.app.dto;

public record OptionDto(String value, String label) {
}
