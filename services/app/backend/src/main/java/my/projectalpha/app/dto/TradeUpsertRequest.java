package my.projectalpha.app.dto;

import jakarta.validation.constraints.Size;

public record TradeUpsertRequest(Long sellerId, @Size(max = 100) String tradeName) {
}
