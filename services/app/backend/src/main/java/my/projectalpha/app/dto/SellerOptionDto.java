package my.projectalpha.app.dto;

public record SellerOptionDto(Long id, String name) {
}
