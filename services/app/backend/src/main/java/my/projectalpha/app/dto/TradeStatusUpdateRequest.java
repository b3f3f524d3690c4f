package my.projectalpha.app.dto;

public record TradeStatusUpdateRequest(String status) {
}
