package my.projectalpha.app.dto;

public record TradeOptionDto(Long id, String name, String sellerName) {
}
