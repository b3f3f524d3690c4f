package my.projectalpha.app.dto;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

/**
 * An extracted valuation. Typed columns are returned under {@code values}; comparables and repairs
 * use the same keys the extraction produced.
 */
public record ExtractedValuationDto(Long id,
									Long assetHubId,
									Long documentId,
									String source,
									Map<String, Object> values,
									List<Map<String, Object>> comparables,
									List<Map<String, Object>> repairs,
									LocalDateTime createdAt,
									String createdBy) {
}
