package my.projectalpha.app.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record SellerUpsertRequest(
		@NotBlank @Size(max = 255) String name,
		@Size(max = 255) String broker,
		@Size(max = 255) String email,
		@Size(max = 255) String poc
) {
}
