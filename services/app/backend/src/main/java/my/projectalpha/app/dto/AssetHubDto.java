package my.projectalpha.app.dto;

import java.time.LocalDateTime;

public record AssetHubDto(Long id,
						  String sellertapeId,
						  String servicerId,
						  String assetStatus,
						  LocalDateTime createdAt,
						  LocalDateTime updatedAt,
						  TapeRowDto latestTapeRow) {
}
